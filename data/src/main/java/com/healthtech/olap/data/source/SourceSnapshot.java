package com.healthtech.olap.data.source;

import java.util.ArrayList;
import java.util.List;

/**
 * Everything one run reads from the OLTP schema. A run never goes back to the source after extraction, so every phase works against
 * the same point-in-time view.
 */
public record SourceSnapshot(
    List<Specialty> specialties,
    List<Department> departments,
    List<Provider> providers,
    List<Patient> patients,
    List<Diagnosis> diagnoses,
    List<Procedure> procedures,
    List<Encounter> encounters,
    List<EncounterDiagnosis> encounterDiagnoses,
    List<EncounterProcedure> encounterProcedures,
    List<BillingLine> billing
) {

    public SourceSnapshot {
        specialties = List.copyOf(specialties);
        departments = List.copyOf(departments);
        providers = List.copyOf(providers);
        patients = List.copyOf(patients);
        diagnoses = List.copyOf(diagnoses);
        procedures = List.copyOf(procedures);
        encounters = List.copyOf(encounters);
        encounterDiagnoses = List.copyOf(encounterDiagnoses);
        encounterProcedures = List.copyOf(encounterProcedures);
        billing = List.copyOf(billing);
    }

    public int totalRows() {
        return specialties.size() + departments.size() + providers.size() + patients.size() + diagnoses.size() + procedures.size()
            + encounters.size() + encounterDiagnoses.size() + encounterProcedures.size() + billing.size();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final List<Specialty> specialties = new ArrayList<>();
        private final List<Department> departments = new ArrayList<>();
        private final List<Provider> providers = new ArrayList<>();
        private final List<Patient> patients = new ArrayList<>();
        private final List<Diagnosis> diagnoses = new ArrayList<>();
        private final List<Procedure> procedures = new ArrayList<>();
        private final List<Encounter> encounters = new ArrayList<>();
        private final List<EncounterDiagnosis> encounterDiagnoses = new ArrayList<>();
        private final List<EncounterProcedure> encounterProcedures = new ArrayList<>();
        private final List<BillingLine> billing = new ArrayList<>();

        public Builder specialty(Specialty specialty) {
            specialties.add(specialty);
            return this;
        }

        public Builder department(Department department) {
            departments.add(department);
            return this;
        }

        public Builder provider(Provider provider) {
            providers.add(provider);
            return this;
        }

        public Builder patient(Patient patient) {
            patients.add(patient);
            return this;
        }

        public Builder diagnosis(Diagnosis diagnosis) {
            diagnoses.add(diagnosis);
            return this;
        }

        public Builder procedure(Procedure procedure) {
            procedures.add(procedure);
            return this;
        }

        public Builder encounter(Encounter encounter) {
            encounters.add(encounter);
            return this;
        }

        public Builder encounterDiagnosis(EncounterDiagnosis link) {
            encounterDiagnoses.add(link);
            return this;
        }

        public Builder encounterProcedure(EncounterProcedure link) {
            encounterProcedures.add(link);
            return this;
        }

        public Builder billing(BillingLine line) {
            billing.add(line);
            return this;
        }

        public Builder specialties(List<Specialty> rows) {
            specialties.addAll(rows);
            return this;
        }

        public Builder departments(List<Department> rows) {
            departments.addAll(rows);
            return this;
        }

        public Builder providers(List<Provider> rows) {
            providers.addAll(rows);
            return this;
        }

        public Builder patients(List<Patient> rows) {
            patients.addAll(rows);
            return this;
        }

        public Builder diagnoses(List<Diagnosis> rows) {
            diagnoses.addAll(rows);
            return this;
        }

        public Builder procedures(List<Procedure> rows) {
            procedures.addAll(rows);
            return this;
        }

        public Builder encounters(List<Encounter> rows) {
            encounters.addAll(rows);
            return this;
        }

        public Builder encounterDiagnoses(List<EncounterDiagnosis> rows) {
            encounterDiagnoses.addAll(rows);
            return this;
        }

        public Builder encounterProcedures(List<EncounterProcedure> rows) {
            encounterProcedures.addAll(rows);
            return this;
        }

        public Builder billing(List<BillingLine> rows) {
            billing.addAll(rows);
            return this;
        }

        public SourceSnapshot build() {
            return new SourceSnapshot(
                specialties, departments, providers, patients, diagnoses, procedures,
                encounters, encounterDiagnoses, encounterProcedures, billing
            );
        }
    }
}
