/*
 * XNAT CBCT Timeline
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.cbct.registration;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.LocalDateTime;

/**
 * Canonical clinical correction recovered from one registration record.
 *
 * Translations are in centimetres, rotations in degrees within (-180, 180].
 * The raw matrices and vendor tuple are kept for audit. Instances are immutable.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"lateral", "longitudinal", "vertical", "coronal", "sagittal", "transverse",
        "applied", "couch_shift", "vendor_alignment", "mask_alignment", "unmatched_transform",
        "correction_transform", "recorded_couch_shift", "registration_protocol", "alignment_time"})
public final class RegistrationShiftRecord {

    private final double lateral;
    private final double longitudinal;
    private final double vertical;
    private final double coronal;
    private final double sagittal;
    private final double transverse;
    private final boolean applied;
    private final CouchShift couchShift;
    private final AlignmentTuple vendorAlignment;
    private final AlignmentTuple maskAlignment;
    private final Transform4x4 unmatchedTransform;
    private final Transform4x4 correctionTransform;
    private final CouchShift recordedCouchShift;
    private final String registrationProtocol;
    private final LocalDateTime alignmentTime;

    private RegistrationShiftRecord(Builder b) {
        this.lateral = b.lateral;
        this.longitudinal = b.longitudinal;
        this.vertical = b.vertical;
        this.coronal = b.coronal;
        this.sagittal = b.sagittal;
        this.transverse = b.transverse;
        this.applied = b.applied;
        this.couchShift = b.couchShift;
        this.vendorAlignment = b.vendorAlignment;
        this.maskAlignment = b.maskAlignment;
        this.unmatchedTransform = b.unmatchedTransform;
        this.correctionTransform = b.correctionTransform;
        this.recordedCouchShift = b.recordedCouchShift;
        this.registrationProtocol = b.registrationProtocol;
        this.alignmentTime = b.alignmentTime;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        Builder b = new Builder();
        b.lateral = lateral;
        b.longitudinal = longitudinal;
        b.vertical = vertical;
        b.coronal = coronal;
        b.sagittal = sagittal;
        b.transverse = transverse;
        b.applied = applied;
        b.couchShift = couchShift;
        b.vendorAlignment = vendorAlignment;
        b.maskAlignment = maskAlignment;
        b.unmatchedTransform = unmatchedTransform;
        b.correctionTransform = correctionTransform;
        b.recordedCouchShift = recordedCouchShift;
        b.registrationProtocol = registrationProtocol;
        b.alignmentTime = alignmentTime;
        return b;
    }

    public double getLateral() { return lateral; }
    public double getLongitudinal() { return longitudinal; }
    public double getVertical() { return vertical; }
    public double getCoronal() { return coronal; }
    public double getSagittal() { return sagittal; }
    public double getTransverse() { return transverse; }

    public boolean isApplied() { return applied; }

    @JsonProperty("couch_shift")
    public CouchShift getCouchShift() { return couchShift; }

    @JsonProperty("vendor_alignment")
    public AlignmentTuple getVendorAlignment() { return vendorAlignment; }

    @JsonProperty("mask_alignment")
    public AlignmentTuple getMaskAlignment() { return maskAlignment; }

    @JsonProperty("unmatched_transform")
    public Transform4x4 getUnmatchedTransform() { return unmatchedTransform; }

    @JsonProperty("correction_transform")
    public Transform4x4 getCorrectionTransform() { return correctionTransform; }

    @JsonProperty("recorded_couch_shift")
    public CouchShift getRecordedCouchShift() { return recordedCouchShift; }

    @JsonProperty("registration_protocol")
    public String getRegistrationProtocol() { return registrationProtocol; }

    @JsonProperty("alignment_time")
    public LocalDateTime getAlignmentTime() { return alignmentTime; }

    @Override
    public String toString() {
        return String.format("RegistrationShiftRecord{lat=%.3f, long=%.3f, vert=%.3f, cor=%.2f, sag=%.2f, trans=%.2f, applied=%s}",
                lateral, longitudinal, vertical, coronal, sagittal, transverse, applied);
    }

    public static final class Builder {
        private double lateral;
        private double longitudinal;
        private double vertical;
        private double coronal;
        private double sagittal;
        private double transverse;
        private boolean applied;
        private CouchShift couchShift;
        private AlignmentTuple vendorAlignment;
        private AlignmentTuple maskAlignment;
        private Transform4x4 unmatchedTransform;
        private Transform4x4 correctionTransform;
        private CouchShift recordedCouchShift;
        private String registrationProtocol;
        private LocalDateTime alignmentTime;

        private Builder() {
        }

        public Builder translation(double lateral, double longitudinal, double vertical) {
            this.lateral = lateral;
            this.longitudinal = longitudinal;
            this.vertical = vertical;
            return this;
        }

        public Builder rotation(double coronal, double sagittal, double transverse) {
            this.coronal = coronal;
            this.sagittal = sagittal;
            this.transverse = transverse;
            return this;
        }

        public Builder applied(boolean applied) {
            this.applied = applied;
            return this;
        }

        public Builder couchShift(CouchShift couchShift) {
            this.couchShift = couchShift;
            return this;
        }

        public Builder vendorAlignment(AlignmentTuple vendorAlignment) {
            this.vendorAlignment = vendorAlignment;
            return this;
        }

        public Builder maskAlignment(AlignmentTuple maskAlignment) {
            this.maskAlignment = maskAlignment;
            return this;
        }

        public Builder unmatchedTransform(Transform4x4 unmatchedTransform) {
            this.unmatchedTransform = unmatchedTransform;
            return this;
        }

        public Builder correctionTransform(Transform4x4 correctionTransform) {
            this.correctionTransform = correctionTransform;
            return this;
        }

        public Builder recordedCouchShift(CouchShift recordedCouchShift) {
            this.recordedCouchShift = recordedCouchShift;
            return this;
        }

        public Builder registrationProtocol(String registrationProtocol) {
            this.registrationProtocol = registrationProtocol;
            return this;
        }

        public Builder alignmentTime(LocalDateTime alignmentTime) {
            this.alignmentTime = alignmentTime;
            return this;
        }

        public RegistrationShiftRecord build() {
            return new RegistrationShiftRecord(this);
        }
    }
}
