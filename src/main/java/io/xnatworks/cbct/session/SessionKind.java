/*
 * XNAT CBCT Timeline
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.cbct.session;

import java.util.Locale;

/**
 * Kind of imaging acquisition, derived from the acquisition preset name.
 */
public enum SessionKind {
    CBCT("cbct"),
    KIM_LEARNING("kim_learning"),
    KIM_MOTION_VIEW("motionview"),
    UNKNOWN("unknown");

    private final String label;

    SessionKind(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Whether sessions of this kind take part in fraction assignment.
     */
    public boolean isAssignable() {
        return this != UNKNOWN;
    }

    /**
     * Resolve an enum name or label, ignoring case.
     */
    public static SessionKind fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Session kind must not be null");
        }
        String normalized = value.trim();
        for (SessionKind kind : values()) {
            if (kind.name().equalsIgnoreCase(normalized) || kind.label.equalsIgnoreCase(normalized)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown session kind: " + value
                + " (expected one of CBCT, KIM_LEARNING, KIM_MOTION_VIEW, UNKNOWN)");
    }

    @Override
    public String toString() {
        return name().toLowerCase(Locale.ROOT);
    }
}
