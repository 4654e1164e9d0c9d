/*
 * XNAT CBCT Timeline
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.cbct.session;

import io.xnatworks.cbct.registration.RegistrationShiftRecord;

import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One imaging acquisition found under a patient root.
 *
 * Discovery attributes are fixed when the session is built. Two annotations are added
 * afterwards, each by a single stage: the session kind (classifier) and an inferred
 * timestamp for undated sessions (date matcher).
 */
public class AcquisitionSession {

    private final Path directory;
    private final String scanId;
    private final LocalDateTime scanTimestamp;
    private final String treatmentId;
    private final String acquisitionPreset;
    private final Double tubeKv;
    private final Double tubeMa;
    private final Path registrationFile;
    private final RegistrationShiftRecord registration;
    private final String registrationError;
    private final String degradation;

    private SessionKind kind = SessionKind.UNKNOWN;
    private LocalDateTime inferredTimestamp;
    private String inferredFrom;
    private final List<String> warnings = Collections.synchronizedList(new ArrayList<>());

    private AcquisitionSession(Builder b) {
        this.directory = b.directory;
        this.scanId = b.scanId != null ? b.scanId : b.directory.getFileName().toString();
        this.scanTimestamp = b.scanTimestamp;
        this.treatmentId = b.treatmentId;
        this.acquisitionPreset = b.acquisitionPreset;
        this.tubeKv = b.tubeKv;
        this.tubeMa = b.tubeMa;
        this.registrationFile = b.registrationFile;
        this.registration = b.registration;
        this.registrationError = b.registrationError;
        this.degradation = b.degradation;
        this.warnings.addAll(b.warnings);
    }

    public static Builder builder(Path directory) {
        return new Builder(directory);
    }

    public Path getDirectory() { return directory; }

    /**
     * Acquisition directory name, used as a stable sort key.
     */
    public String getDirectoryName() {
        return directory.getFileName().toString();
    }

    public String getScanId() { return scanId; }
    public LocalDateTime getScanTimestamp() { return scanTimestamp; }
    public String getTreatmentId() { return treatmentId; }
    public String getAcquisitionPreset() { return acquisitionPreset; }
    public Double getTubeKv() { return tubeKv; }
    public Double getTubeMa() { return tubeMa; }

    /**
     * Registration record file found for this acquisition, whether or not it could be read.
     */
    public Path getRegistrationFile() { return registrationFile; }

    /**
     * Reconciled registration, or {@code null} when there is none or it was unreadable.
     */
    public RegistrationShiftRecord getRegistration() { return registration; }

    public boolean hasRegistration() {
        return registration != null;
    }

    public boolean hasRegistrationFile() {
        return registrationFile != null;
    }

    /**
     * Why the registration record could not be used, when a file exists but failed to decode.
     */
    public String getRegistrationError() { return registrationError; }

    /**
     * Why discovery was incomplete (missing or unreadable metadata), or {@code null}.
     */
    public String getDegradation() { return degradation; }

    public boolean isDegraded() {
        return degradation != null || registrationError != null;
    }

    public SessionKind getKind() { return kind; }

    public void setKind(SessionKind kind) {
        this.kind = kind == null ? SessionKind.UNKNOWN : kind;
    }

    public LocalDateTime getInferredTimestamp() { return inferredTimestamp; }

    /**
     * Directory name of the session the inferred timestamp was taken from.
     */
    public String getInferredFrom() { return inferredFrom; }

    public void setInferredTimestamp(LocalDateTime inferredTimestamp, String inferredFrom) {
        this.inferredTimestamp = inferredTimestamp;
        this.inferredFrom = inferredFrom;
    }

    /**
     * Scan timestamp if known, else the inferred one.
     */
    public LocalDateTime getEffectiveTimestamp() {
        return scanTimestamp != null ? scanTimestamp : inferredTimestamp;
    }

    public List<String> getWarnings() {
        synchronized (warnings) {
            return Collections.unmodifiableList(new ArrayList<>(warnings));
        }
    }

    public void addWarning(String warning) {
        warnings.add(warning);
    }

    @Override
    public String toString() {
        return "AcquisitionSession{" + getDirectoryName() + ", scanId=" + scanId + ", kind=" + kind
                + ", time=" + getEffectiveTimestamp() + ", registration=" + (registration != null) + "}";
    }

    public static class Builder {
        private final Path directory;
        private String scanId;
        private LocalDateTime scanTimestamp;
        private String treatmentId;
        private String acquisitionPreset;
        private Double tubeKv;
        private Double tubeMa;
        private Path registrationFile;
        private RegistrationShiftRecord registration;
        private String registrationError;
        private String degradation;
        private final List<String> warnings = new ArrayList<>();

        private Builder(Path directory) {
            if (directory == null) {
                throw new IllegalArgumentException("directory is required");
            }
            this.directory = directory;
        }

        public Path getDirectory() { return directory; }
        public Path getRegistrationFile() { return registrationFile; }

        public Builder scanId(String scanId) {
            this.scanId = scanId;
            return this;
        }

        public Builder scanTimestamp(LocalDateTime scanTimestamp) {
            this.scanTimestamp = scanTimestamp;
            return this;
        }

        public Builder treatmentId(String treatmentId) {
            this.treatmentId = treatmentId;
            return this;
        }

        public Builder acquisitionPreset(String acquisitionPreset) {
            this.acquisitionPreset = acquisitionPreset;
            return this;
        }

        public Builder tubeKv(Double tubeKv) {
            this.tubeKv = tubeKv;
            return this;
        }

        public Builder tubeMa(Double tubeMa) {
            this.tubeMa = tubeMa;
            return this;
        }

        public Builder registrationFile(Path registrationFile) {
            this.registrationFile = registrationFile;
            return this;
        }

        public Builder registration(RegistrationShiftRecord registration) {
            this.registration = registration;
            return this;
        }

        public Builder registrationError(String registrationError) {
            this.registrationError = registrationError;
            return this;
        }

        /**
         * Record a discovery problem. Multiple problems are joined.
         */
        public Builder degradation(String degradation) {
            this.degradation = this.degradation == null ? degradation : this.degradation + "; " + degradation;
            return this;
        }

        public Builder warning(String warning) {
            this.warnings.add(warning);
            return this;
        }

        public AcquisitionSession build() {
            return new AcquisitionSession(this);
        }
    }
}
