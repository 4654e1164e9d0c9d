/*
 * XNAT CBCT Timeline
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.cbct.registration;

/**
 * Axis permutation and sign multipliers that turn a vendor alignment tuple into the
 * clinical shift record.
 *
 * The default table was validated against an independent clinical log for one patient
 * over four fractions. It is kept as data so that a later validation can supply a
 * different table without touching {@link CoordinateReconciler}.
 */
public final class ReconciliationTable {

    /**
     * Components of the vendor alignment tuple, in field order.
     */
    public enum VendorAxis {
        LATERAL, LONGITUDINAL, VERTICAL, ROTATION, PITCH, ROLL;

        public double valueOf(AlignmentTuple tuple) {
            switch (this) {
                case LATERAL: return tuple.getLateral();
                case LONGITUDINAL: return tuple.getLongitudinal();
                case VERTICAL: return tuple.getVertical();
                case ROTATION: return tuple.getRotation();
                case PITCH: return tuple.getPitch();
                case ROLL: return tuple.getRoll();
                default: throw new IllegalStateException("Unhandled axis " + this);
            }
        }

        public boolean isRotation() {
            return this == ROTATION || this == PITCH || this == ROLL;
        }
    }

    /**
     * One clinical component: the vendor axis it is read from and the sign applied.
     */
    public static final class AxisMapping {
        private final VendorAxis source;
        private final double multiplier;

        public AxisMapping(VendorAxis source, double multiplier) {
            if (source == null) {
                throw new IllegalArgumentException("source axis is required");
            }
            if (multiplier != 1.0 && multiplier != -1.0) {
                throw new IllegalArgumentException("multiplier must be +1 or -1, got " + multiplier);
            }
            this.source = source;
            this.multiplier = multiplier;
        }

        public VendorAxis getSource() { return source; }
        public double getMultiplier() { return multiplier; }

        @Override
        public String toString() {
            return (multiplier < 0 ? "-" : "+") + source.name().toLowerCase();
        }
    }

    public static final AxisMapping LATERAL = new AxisMapping(VendorAxis.LATERAL, 1.0);
    public static final AxisMapping LONGITUDINAL = new AxisMapping(VendorAxis.LONGITUDINAL, 1.0);
    public static final AxisMapping VERTICAL = new AxisMapping(VendorAxis.VERTICAL, 1.0);
    public static final AxisMapping CORONAL = new AxisMapping(VendorAxis.ROLL, 1.0);
    public static final AxisMapping SAGITTAL = new AxisMapping(VendorAxis.ROTATION, 1.0);
    public static final AxisMapping TRANSVERSE = new AxisMapping(VendorAxis.PITCH, -1.0);

    /** Couch translation is sign-opposite to the image-space correction. */
    public static final double COUCH_TRANSLATION_MULTIPLIER = -1.0;

    public static final ReconciliationTable DEFAULT = new ReconciliationTable(
            LATERAL, LONGITUDINAL, VERTICAL, CORONAL, SAGITTAL, TRANSVERSE, COUCH_TRANSLATION_MULTIPLIER);

    private final AxisMapping lateral;
    private final AxisMapping longitudinal;
    private final AxisMapping vertical;
    private final AxisMapping coronal;
    private final AxisMapping sagittal;
    private final AxisMapping transverse;
    private final double couchTranslationMultiplier;

    public ReconciliationTable(AxisMapping lateral, AxisMapping longitudinal, AxisMapping vertical,
                               AxisMapping coronal, AxisMapping sagittal, AxisMapping transverse,
                               double couchTranslationMultiplier) {
        requireKind(lateral, false, "lateral");
        requireKind(longitudinal, false, "longitudinal");
        requireKind(vertical, false, "vertical");
        requireKind(coronal, true, "coronal");
        requireKind(sagittal, true, "sagittal");
        requireKind(transverse, true, "transverse");
        this.lateral = lateral;
        this.longitudinal = longitudinal;
        this.vertical = vertical;
        this.coronal = coronal;
        this.sagittal = sagittal;
        this.transverse = transverse;
        this.couchTranslationMultiplier = couchTranslationMultiplier;
    }

    private static void requireKind(AxisMapping mapping, boolean rotation, String name) {
        if (mapping == null) {
            throw new IllegalArgumentException(name + " mapping is required");
        }
        if (mapping.getSource().isRotation() != rotation) {
            throw new IllegalArgumentException(name + " must map from a "
                    + (rotation ? "rotation" : "translation") + " axis, got " + mapping.getSource());
        }
    }

    public AxisMapping getLateral() { return lateral; }
    public AxisMapping getLongitudinal() { return longitudinal; }
    public AxisMapping getVertical() { return vertical; }
    public AxisMapping getCoronal() { return coronal; }
    public AxisMapping getSagittal() { return sagittal; }
    public AxisMapping getTransverse() { return transverse; }
    public double getCouchTranslationMultiplier() { return couchTranslationMultiplier; }

    @Override
    public String toString() {
        return "ReconciliationTable{lateral=" + lateral + ", longitudinal=" + longitudinal
                + ", vertical=" + vertical + ", coronal=" + coronal + ", sagittal=" + sagittal
                + ", transverse=" + transverse + ", couch=" + couchTranslationMultiplier + "}";
    }
}
