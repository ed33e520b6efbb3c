package com.healthtech.olap.data.run;

/**
 * Phase tags written to etl_control.etl_phase, in the order a successful run passes through them.
 */
public enum EtlPhase {
    INITIALIZATION,
    SOURCE_EXTRACTED,
    DIM_SPECIALTY_LOADED,
    DIM_DEPARTMENT_LOADED,
    DIM_PROVIDER_LOADED,
    DIM_PATIENT_LOADED,
    DIM_DIAGNOSIS_LOADED,
    DIM_PROCEDURE_LOADED,
    DIM_ENCOUNTER_TYPE_LOADED,
    DIM_DATE_LOADED,
    ALL_DIMENSIONS_LOADED,
    STAGING_TABLE_CREATED,
    FACT_TABLE_LOADED,
    READMISSIONS_FLAGGED,
    BRIDGES_LOADED,
    CLEANUP_COMPLETE,
    PUBLISHED,
    COMPLETED
}
