/*
 * XNAT CBCT Timeline
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.cbct.dicom;

import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Top-level attributes of a DICOM record, keyed by tag in file order.
 */
public final class DicomDataset {

    public static final int SOP_INSTANCE_UID = 0x00080018;
    public static final int CONTENT_DATE = 0x00080023;
    public static final int CONTENT_TIME = 0x00080033;
    public static final int MODALITY = 0x00080060;
    public static final int MANUFACTURER = 0x00080070;

    private final String transferSyntaxUid;
    private final Map<Integer, DicomElement> elements;

    public DicomDataset(String transferSyntaxUid, Map<Integer, DicomElement> elements) {
        this.transferSyntaxUid = transferSyntaxUid;
        this.elements = Collections.unmodifiableMap(new LinkedHashMap<>(elements));
    }

    public String getTransferSyntaxUid() { return transferSyntaxUid; }

    public boolean contains(int tag) {
        return elements.containsKey(tag);
    }

    public boolean contains(DicomTag tag) {
        return contains(tag.toInt());
    }

    public DicomElement get(int tag) {
        return elements.get(tag);
    }

    public DicomElement get(DicomTag tag) {
        return get(tag.toInt());
    }

    /**
     * Raw bytes of an element, or {@code null} when absent or a sequence.
     */
    public byte[] getBytes(int tag) {
        DicomElement element = elements.get(tag);
        return element == null ? null : element.getValue();
    }

    public byte[] getBytes(DicomTag tag) {
        return getBytes(tag.toInt());
    }

    /**
     * String value with DICOM padding (trailing NUL and spaces) removed.
     */
    public String getString(int tag) {
        byte[] value = getBytes(tag);
        if (value == null) {
            return null;
        }
        String text = new String(value, StandardCharsets.ISO_8859_1);
        int end = text.length();
        while (end > 0 && (text.charAt(end - 1) == ' ' || text.charAt(end - 1) == '\0')) {
            end--;
        }
        return text.substring(0, end).trim();
    }

    public Set<Integer> tags() {
        return elements.keySet();
    }

    public int size() {
        return elements.size();
    }

    @Override
    public String toString() {
        return String.format("DicomDataset{transferSyntax=%s, elements=%d}", transferSyntaxUid, elements.size());
    }
}
