package com.healthtech.olap.data.source;

import java.time.LocalDate;

public record Patient(int patientId, String firstName, String lastName, String gender, LocalDate dateOfBirth, String mrn) {
}
