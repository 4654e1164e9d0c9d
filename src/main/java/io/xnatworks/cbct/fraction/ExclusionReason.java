/*
 * XNAT CBCT Timeline
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.cbct.fraction;

/**
 * Why a session is missing from the timeline or from the transfer-eligible subset.
 */
public enum ExclusionReason {
    /** No scan timestamp could be derived; not placed in the timeline. */
    NO_TIMESTAMP("no scan timestamp"),
    /** Preset not recognised; not placed in the timeline. */
    UNKNOWN_KIND("unrecognised acquisition preset"),
    /** In the timeline, but no registration record was found. */
    NO_REGISTRATION("no registration record"),
    /** In the timeline, but the registration record could not be decoded. */
    REGISTRATION_UNREADABLE("registration record unreadable"),
    /** In the timeline, but the reconciled correction is all zero. */
    REGISTRATION_NOT_APPLIED("registration not applied");

    private final String description;

    ExclusionReason(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }

    /**
     * Whether sessions excluded for this reason still appear in the full timeline.
     */
    public boolean isInTimeline() {
        return this != NO_TIMESTAMP && this != UNKNOWN_KIND;
    }
}
