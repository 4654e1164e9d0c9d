/*
 * XNAT CBCT Timeline
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.cbct.registration;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * The vendor's six-value clipbox alignment, in the order it appears in the field:
 * lateral, longitudinal, vertical (cm), rotation, pitch, roll (degrees, [0, 360)).
 */
@JsonPropertyOrder({"lateral", "longitudinal", "vertical", "rotation", "pitch", "roll"})
public final class AlignmentTuple {

    public static final int VALUE_COUNT = 6;

    private final double lateral;
    private final double longitudinal;
    private final double vertical;
    private final double rotation;
    private final double pitch;
    private final double roll;

    public AlignmentTuple(double lateral, double longitudinal, double vertical,
                          double rotation, double pitch, double roll) {
        this.lateral = lateral;
        this.longitudinal = longitudinal;
        this.vertical = vertical;
        this.rotation = rotation;
        this.pitch = pitch;
        this.roll = roll;
    }

    public static AlignmentTuple of(double[] values) {
        if (values == null || values.length != VALUE_COUNT) {
            throw new IllegalArgumentException("An alignment tuple needs exactly " + VALUE_COUNT + " values");
        }
        return new AlignmentTuple(values[0], values[1], values[2], values[3], values[4], values[5]);
    }

    public double getLateral() { return lateral; }
    public double getLongitudinal() { return longitudinal; }
    public double getVertical() { return vertical; }
    public double getRotation() { return rotation; }
    public double getPitch() { return pitch; }
    public double getRoll() { return roll; }

    public double[] toArray() {
        return new double[] { lateral, longitudinal, vertical, rotation, pitch, roll };
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AlignmentTuple)) return false;
        AlignmentTuple that = (AlignmentTuple) o;
        return Double.compare(lateral, that.lateral) == 0
                && Double.compare(longitudinal, that.longitudinal) == 0
                && Double.compare(vertical, that.vertical) == 0
                && Double.compare(rotation, that.rotation) == 0
                && Double.compare(pitch, that.pitch) == 0
                && Double.compare(roll, that.roll) == 0;
    }

    @Override
    public int hashCode() {
        return java.util.Arrays.hashCode(toArray());
    }

    @Override
    public String toString() {
        return "AlignmentTuple{lat=" + lateral + ", long=" + longitudinal + ", vert=" + vertical
                + ", rot=" + rotation + ", pitch=" + pitch + ", roll=" + roll + "}";
    }
}
