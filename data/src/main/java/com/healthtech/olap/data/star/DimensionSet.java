package com.healthtech.olap.data.star;

import java.util.List;

/**
 * The eight dimensions of one run. Dates carry no surrogate key of their own: the date key is the encoded date.
 */
public record DimensionSet(
    DimensionTable<Integer, SpecialtyDimension> specialties,
    DimensionTable<Integer, DepartmentDimension> departments,
    DimensionTable<Integer, ProviderDimension> providers,
    DimensionTable<Integer, PatientDimension> patients,
    DimensionTable<Integer, DiagnosisDimension> diagnoses,
    DimensionTable<Integer, ProcedureDimension> procedures,
    DimensionTable<String, EncounterTypeDimension> encounterTypes,
    List<DateDimension> dates
) {

    public DimensionSet {
        dates = List.copyOf(dates);
    }

    public int totalRows() {
        return specialties.size() + departments.size() + providers.size() + patients.size() + diagnoses.size() + procedures.size()
            + encounterTypes.size() + dates.size();
    }
}
