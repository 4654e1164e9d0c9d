/*
 * XNAT CBCT Timeline
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.cbct.report;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.xnatworks.cbct.registration.RegistrationShiftRecord;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * JSON document describing one patient's reconstructed timeline, for the export
 * and reporting tools downstream.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TimelineReport {

    @JsonProperty("patient_root")
    private String patientRoot;

    @JsonProperty("generated_at")
    private LocalDateTime generatedAt;

    @JsonProperty("session_count")
    private int sessionCount;

    @JsonProperty("fraction_count")
    private int fractionCount;

    private List<SessionRow> sessions = new ArrayList<>();
    private List<FractionRow> fractions = new ArrayList<>();

    @JsonProperty("eligible_scan_ids")
    private List<String> eligibleScanIds = new ArrayList<>();

    private List<ExclusionRow> exclusions = new ArrayList<>();

    public String getPatientRoot() { return patientRoot; }
    public void setPatientRoot(String patientRoot) { this.patientRoot = patientRoot; }

    public LocalDateTime getGeneratedAt() { return generatedAt; }
    public void setGeneratedAt(LocalDateTime generatedAt) { this.generatedAt = generatedAt; }

    public int getSessionCount() { return sessionCount; }
    public void setSessionCount(int sessionCount) { this.sessionCount = sessionCount; }

    public int getFractionCount() { return fractionCount; }
    public void setFractionCount(int fractionCount) { this.fractionCount = fractionCount; }

    public List<SessionRow> getSessions() { return sessions; }
    public void setSessions(List<SessionRow> sessions) { this.sessions = sessions; }

    public List<FractionRow> getFractions() { return fractions; }
    public void setFractions(List<FractionRow> fractions) { this.fractions = fractions; }

    public List<String> getEligibleScanIds() { return eligibleScanIds; }
    public void setEligibleScanIds(List<String> eligibleScanIds) { this.eligibleScanIds = eligibleScanIds; }

    public List<ExclusionRow> getExclusions() { return exclusions; }
    public void setExclusions(List<ExclusionRow> exclusions) { this.exclusions = exclusions; }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class SessionRow {
        private String directory;

        @JsonProperty("scan_id")
        private String scanId;

        private String kind;

        @JsonProperty("scan_timestamp")
        private LocalDateTime scanTimestamp;

        @JsonProperty("inferred_timestamp")
        private LocalDateTime inferredTimestamp;

        @JsonProperty("treatment_id")
        private String treatmentId;

        @JsonProperty("acquisition_preset")
        private String acquisitionPreset;

        @JsonProperty("tube_kv")
        private Double tubeKv;

        @JsonProperty("tube_ma")
        private Double tubeMa;

        @JsonProperty("has_registration")
        private boolean hasRegistration;

        @JsonProperty("registration_file")
        private String registrationFile;

        private RegistrationShiftRecord registration;

        @JsonProperty("registration_error")
        private String registrationError;

        private String degradation;

        private List<String> warnings;

        public String getDirectory() { return directory; }
        public void setDirectory(String directory) { this.directory = directory; }

        public String getScanId() { return scanId; }
        public void setScanId(String scanId) { this.scanId = scanId; }

        public String getKind() { return kind; }
        public void setKind(String kind) { this.kind = kind; }

        public LocalDateTime getScanTimestamp() { return scanTimestamp; }
        public void setScanTimestamp(LocalDateTime scanTimestamp) { this.scanTimestamp = scanTimestamp; }

        public LocalDateTime getInferredTimestamp() { return inferredTimestamp; }
        public void setInferredTimestamp(LocalDateTime inferredTimestamp) { this.inferredTimestamp = inferredTimestamp; }

        public String getTreatmentId() { return treatmentId; }
        public void setTreatmentId(String treatmentId) { this.treatmentId = treatmentId; }

        public String getAcquisitionPreset() { return acquisitionPreset; }
        public void setAcquisitionPreset(String acquisitionPreset) { this.acquisitionPreset = acquisitionPreset; }

        public Double getTubeKv() { return tubeKv; }
        public void setTubeKv(Double tubeKv) { this.tubeKv = tubeKv; }

        public Double getTubeMa() { return tubeMa; }
        public void setTubeMa(Double tubeMa) { this.tubeMa = tubeMa; }

        public boolean isHasRegistration() { return hasRegistration; }
        public void setHasRegistration(boolean hasRegistration) { this.hasRegistration = hasRegistration; }

        public String getRegistrationFile() { return registrationFile; }
        public void setRegistrationFile(String registrationFile) { this.registrationFile = registrationFile; }

        public RegistrationShiftRecord getRegistration() { return registration; }
        public void setRegistration(RegistrationShiftRecord registration) { this.registration = registration; }

        public String getRegistrationError() { return registrationError; }
        public void setRegistrationError(String registrationError) { this.registrationError = registrationError; }

        public String getDegradation() { return degradation; }
        public void setDegradation(String degradation) { this.degradation = degradation; }

        public List<String> getWarnings() { return warnings; }
        public void setWarnings(List<String> warnings) { this.warnings = warnings; }
    }

    public static class FractionRow {
        private int index;
        private String label;
        private LocalDate date;
        private List<EntryRow> entries = new ArrayList<>();

        public int getIndex() { return index; }
        public void setIndex(int index) { this.index = index; }

        public String getLabel() { return label; }
        public void setLabel(String label) { this.label = label; }

        public LocalDate getDate() { return date; }
        public void setDate(LocalDate date) { this.date = date; }

        public List<EntryRow> getEntries() { return entries; }
        public void setEntries(List<EntryRow> entries) { this.entries = entries; }
    }

    public static class EntryRow {
        @JsonProperty("scan_id")
        private String scanId;

        private String directory;

        private String kind;

        @JsonProperty("intra_fraction_index")
        private int intraFractionIndex;

        private boolean eligible;

        public String getScanId() { return scanId; }
        public void setScanId(String scanId) { this.scanId = scanId; }

        public String getDirectory() { return directory; }
        public void setDirectory(String directory) { this.directory = directory; }

        public String getKind() { return kind; }
        public void setKind(String kind) { this.kind = kind; }

        public int getIntraFractionIndex() { return intraFractionIndex; }
        public void setIntraFractionIndex(int intraFractionIndex) { this.intraFractionIndex = intraFractionIndex; }

        public boolean isEligible() { return eligible; }
        public void setEligible(boolean eligible) { this.eligible = eligible; }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ExclusionRow {
        @JsonProperty("scan_id")
        private String scanId;

        private String directory;

        private String reason;

        private String detail;

        public String getScanId() { return scanId; }
        public void setScanId(String scanId) { this.scanId = scanId; }

        public String getDirectory() { return directory; }
        public void setDirectory(String directory) { this.directory = directory; }

        public String getReason() { return reason; }
        public void setReason(String reason) { this.reason = reason; }

        public String getDetail() { return detail; }
        public void setDetail(String detail) { this.detail = detail; }
    }
}
