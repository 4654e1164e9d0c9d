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

/**
 * Physical couch movement corresponding to a registration correction.
 * Rotations are {@code null} when the source does not record them.
 */
@JsonInclude(JsonInclude.Include.ALWAYS)
public final class CouchShift {

    private final Double lateral;
    private final Double longitudinal;
    private final Double vertical;
    private final Double pitch;
    private final Double roll;
    private final Double rotation;

    public CouchShift(Double lateral, Double longitudinal, Double vertical) {
        this(lateral, longitudinal, vertical, null, null, null);
    }

    public CouchShift(Double lateral, Double longitudinal, Double vertical,
                      Double pitch, Double roll, Double rotation) {
        this.lateral = lateral;
        this.longitudinal = longitudinal;
        this.vertical = vertical;
        this.pitch = pitch;
        this.roll = roll;
        this.rotation = rotation;
    }

    public Double getLateral() { return lateral; }
    public Double getLongitudinal() { return longitudinal; }
    public Double getVertical() { return vertical; }
    public Double getPitch() { return pitch; }
    public Double getRoll() { return roll; }
    public Double getRotation() { return rotation; }

    @JsonProperty("rotation_available")
    public boolean isRotationAvailable() {
        return pitch != null && roll != null && rotation != null;
    }

    @Override
    public String toString() {
        return "CouchShift{lat=" + lateral + ", long=" + longitudinal + ", vert=" + vertical
                + (isRotationAvailable() ? ", pitch=" + pitch + ", roll=" + roll + ", rot=" + rotation
                : ", rotations=unavailable") + "}";
    }
}
