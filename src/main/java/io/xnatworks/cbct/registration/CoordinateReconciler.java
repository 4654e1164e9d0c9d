/*
 * XNAT CBCT Timeline
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.cbct.registration;

import io.xnatworks.cbct.registration.ReconciliationTable.AxisMapping;

/**
 * Converts a vendor alignment tuple into the clinical shift record using a
 * {@link ReconciliationTable}. The mapping is never inferred from the record itself.
 */
public class CoordinateReconciler {

    private final ReconciliationTable table;

    public CoordinateReconciler() {
        this(ReconciliationTable.DEFAULT);
    }

    public CoordinateReconciler(ReconciliationTable table) {
        if (table == null) {
            throw new IllegalArgumentException("reconciliation table is required");
        }
        this.table = table;
    }

    public ReconciliationTable getTable() {
        return table;
    }

    /**
     * Normalise an angle in degrees into (-180, 180].
     * Vendor rotations arrive in [0, 360), so 359.8 becomes -0.2 and 180 stays 180.
     * Values already in range are returned unchanged.
     */
    public static double unwrap(double degrees) {
        double v = degrees % 360.0;
        if (v > 180.0) {
            v -= 360.0;
        } else if (v <= -180.0) {
            v += 360.0;
        }
        return v + 0.0;
    }

    /**
     * Reconcile a vendor tuple. The result carries the alignment, the derived couch
     * shift and the applied flag; matrices and audit fields are left for the caller.
     */
    public RegistrationShiftRecord reconcile(AlignmentTuple vendor) {
        double lateral = component(table.getLateral(), vendor);
        double longitudinal = component(table.getLongitudinal(), vendor);
        double vertical = component(table.getVertical(), vendor);
        double coronal = component(table.getCoronal(), vendor);
        double sagittal = component(table.getSagittal(), vendor);
        double transverse = component(table.getTransverse(), vendor);

        boolean applied = lateral != 0.0 || longitudinal != 0.0 || vertical != 0.0
                || coronal != 0.0 || sagittal != 0.0 || transverse != 0.0;

        double couch = table.getCouchTranslationMultiplier();
        CouchShift couchShift = new CouchShift(
                couch * lateral + 0.0, couch * longitudinal + 0.0, couch * vertical + 0.0);

        return RegistrationShiftRecord.builder()
                .translation(lateral, longitudinal, vertical)
                .rotation(coronal, sagittal, transverse)
                .applied(applied)
                .couchShift(couchShift)
                .vendorAlignment(vendor)
                .build();
    }

    private static double component(AxisMapping mapping, AlignmentTuple vendor) {
        double raw = mapping.getSource().valueOf(vendor);
        if (mapping.getSource().isRotation()) {
            // Unwrap before mapping, then again so a negated 180 stays in range
            return unwrap(mapping.getMultiplier() * unwrap(raw));
        }
        return mapping.getMultiplier() * raw + 0.0;
    }
}
