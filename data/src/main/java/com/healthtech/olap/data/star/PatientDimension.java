package com.healthtech.olap.data.star;

import java.time.LocalDate;

public record PatientDimension(
    int patientKey,
    int patientId,
    String firstName,
    String lastName,
    String gender,
    LocalDate dateOfBirth,
    String mrn,
    int currentAge,
    String ageGroup
) {
}
