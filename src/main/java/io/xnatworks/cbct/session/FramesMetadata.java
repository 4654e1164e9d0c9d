/*
 * XNAT CBCT Timeline
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.cbct.session;

/**
 * Acquisition details read from a frame-metadata file. Any field may be {@code null}.
 */
public final class FramesMetadata {

    private final String treatmentId;
    private final String acquisitionPreset;
    private final String dicomUid;
    private final Double tubeKv;
    private final Double tubeMa;

    public FramesMetadata(String treatmentId, String acquisitionPreset, String dicomUid,
                          Double tubeKv, Double tubeMa) {
        this.treatmentId = treatmentId;
        this.acquisitionPreset = acquisitionPreset;
        this.dicomUid = dicomUid;
        this.tubeKv = tubeKv;
        this.tubeMa = tubeMa;
    }

    public String getTreatmentId() { return treatmentId; }
    public String getAcquisitionPreset() { return acquisitionPreset; }
    public String getDicomUid() { return dicomUid; }
    public Double getTubeKv() { return tubeKv; }
    public Double getTubeMa() { return tubeMa; }

    @Override
    public String toString() {
        return "FramesMetadata{treatment=" + treatmentId + ", preset=" + acquisitionPreset
                + ", uid=" + dicomUid + ", kV=" + tubeKv + ", mA=" + tubeMa + "}";
    }
}
