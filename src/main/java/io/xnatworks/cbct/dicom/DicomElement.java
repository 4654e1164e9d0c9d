/*
 * XNAT CBCT Timeline
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.cbct.dicom;

/**
 * One top-level attribute as read from the wire.
 * Sequences are walked but not materialised, so their value is {@code null}.
 */
public final class DicomElement {

    private final int tag;
    private final String vr;
    private final byte[] value;

    public DicomElement(int tag, String vr, byte[] value) {
        this.tag = tag;
        this.vr = vr;
        this.value = value;
    }

    public int getTag() { return tag; }

    /**
     * Value representation, or {@code null} when the dataset was implicit VR.
     */
    public String getVr() { return vr; }

    public boolean hasValue() {
        return value != null && value.length > 0;
    }

    public int length() {
        return value == null ? 0 : value.length;
    }

    /**
     * Copy of the raw value bytes, or {@code null} for sequences.
     */
    public byte[] getValue() {
        return value == null ? null : value.clone();
    }

    @Override
    public String toString() {
        return String.format("DicomElement{tag=%s, vr=%s, length=%d}",
                DicomTag.valueOf(tag), vr, length());
    }
}
