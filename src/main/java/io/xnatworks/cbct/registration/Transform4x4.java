/*
 * XNAT CBCT Timeline
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.cbct.registration;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Arrays;

/**
 * Homogeneous 4x4 transform in the vendor's raw convention, stored row-major.
 */
public final class Transform4x4 {

    public static final int SIZE = 4;
    public static final int ELEMENT_COUNT = SIZE * SIZE;

    private final double[] values;

    public Transform4x4(double[] rowMajor) {
        if (rowMajor == null || rowMajor.length != ELEMENT_COUNT) {
            throw new IllegalArgumentException("A 4x4 transform needs exactly " + ELEMENT_COUNT + " values");
        }
        this.values = rowMajor.clone();
    }

    public static Transform4x4 identity() {
        double[] v = new double[ELEMENT_COUNT];
        for (int i = 0; i < SIZE; i++) {
            v[i * SIZE + i] = 1.0;
        }
        return new Transform4x4(v);
    }

    public double get(int row, int col) {
        if (row < 0 || row >= SIZE || col < 0 || col >= SIZE) {
            throw new IndexOutOfBoundsException("(" + row + "," + col + ")");
        }
        return values[row * SIZE + col];
    }

    @JsonProperty("row_major")
    public double[] toRowMajor() {
        return values.clone();
    }

    @JsonIgnore
    public double[][] toRows() {
        double[][] rows = new double[SIZE][SIZE];
        for (int r = 0; r < SIZE; r++) {
            System.arraycopy(values, r * SIZE, rows[r], 0, SIZE);
        }
        return rows;
    }

    /**
     * Translation column (x, y, z) of the transform.
     */
    @JsonIgnore
    public double[] getTranslation() {
        return new double[] { values[3], values[7], values[11] };
    }

    @JsonIgnore
    public boolean isIdentity() {
        return Arrays.equals(values, identity().values);
    }

    /**
     * Re-serialise in the vendor field format: 16 space-separated values, row-major.
     */
    public String toFieldString() {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < ELEMENT_COUNT; i++) {
            if (i > 0) {
                sb.append(' ');
            }
            sb.append(values[i]);
        }
        return sb.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Transform4x4)) return false;
        return Arrays.equals(values, ((Transform4x4) o).values);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return "Transform4x4[" + toFieldString() + "]";
    }
}
