package com.healthtech.olap.data.source;

/**
 * A row of the OLTP providers table. {@code specialtyId} is how an encounter gets attributed to a specialty.
 */
public record Provider(int providerId, String firstName, String lastName, String credential, Integer specialtyId) {
}
