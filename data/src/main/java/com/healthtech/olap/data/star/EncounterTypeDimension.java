package com.healthtech.olap.data.star;

import java.util.Locale;

/**
 * Lookup dimension built from the encounter type strings actually seen on encounters.
 */
public record EncounterTypeDimension(int encounterTypeKey, String encounterTypeName) {

    /**
     * Canonical form used both to build the dimension and to look it up: trimmed, upper case. A blank type normalizes to the empty
     * string and is a type of its own; only a null type never resolves.
     */
    public static String normalize(String encounterType) {
        if (encounterType == null) {
            return null;
        }
        return encounterType.trim().toUpperCase(Locale.ROOT);
    }
}
