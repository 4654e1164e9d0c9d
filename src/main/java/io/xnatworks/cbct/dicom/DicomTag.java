/*
 * XNAT CBCT Timeline
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.cbct.dicom;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A (group,element) attribute locator, e.g. {@code (0021,103A)}.
 */
public final class DicomTag {

    private static final Pattern TAG_PATTERN =
            Pattern.compile("^\\(?\\s*([0-9A-Fa-f]{4})\\s*,?\\s*([0-9A-Fa-f]{4})\\s*\\)?$");

    private final int group;
    private final int element;

    public DicomTag(int group, int element) {
        if (group < 0 || group > 0xFFFF || element < 0 || element > 0xFFFF) {
            throw new IllegalArgumentException(
                    String.format("Tag out of range: group=%d element=%d", group, element));
        }
        this.group = group;
        this.element = element;
    }

    /**
     * Parse "(gggg,eeee)", "gggg,eeee" or "ggggeeee" (hex).
     */
    public static DicomTag parse(String text) {
        if (text == null) {
            throw new IllegalArgumentException("Tag must not be null");
        }
        Matcher m = TAG_PATTERN.matcher(text.trim());
        if (!m.matches()) {
            throw new IllegalArgumentException("Invalid DICOM tag: " + text);
        }
        return new DicomTag(Integer.parseInt(m.group(1), 16), Integer.parseInt(m.group(2), 16));
    }

    public static DicomTag valueOf(int tag) {
        return new DicomTag(tag >>> 16, tag & 0xFFFF);
    }

    public int getGroup() { return group; }

    public int getElement() { return element; }

    public int toInt() {
        return (group << 16) | element;
    }

    /**
     * Odd groups are vendor-private.
     */
    public boolean isPrivate() {
        return (group & 1) == 1;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DicomTag)) return false;
        DicomTag other = (DicomTag) o;
        return group == other.group && element == other.element;
    }

    @Override
    public int hashCode() {
        return toInt();
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "(%04X,%04X)", group, element);
    }
}
