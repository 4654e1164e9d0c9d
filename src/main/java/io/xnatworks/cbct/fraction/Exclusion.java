/*
 * XNAT CBCT Timeline
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.cbct.fraction;

import io.xnatworks.cbct.session.AcquisitionSession;

/**
 * One entry of the exclusion report.
 */
public final class Exclusion {

    private final AcquisitionSession session;
    private final ExclusionReason reason;
    private final String detail;

    public Exclusion(AcquisitionSession session, ExclusionReason reason, String detail) {
        this.session = session;
        this.reason = reason;
        this.detail = detail;
    }

    public AcquisitionSession getSession() { return session; }

    public String getSessionId() {
        return session.getScanId();
    }

    public ExclusionReason getReason() { return reason; }

    /**
     * Human-readable detail, e.g. the decoding error. May be {@code null}.
     */
    public String getDetail() { return detail; }

    @Override
    public String toString() {
        return session.getScanId() + ": " + reason + (detail != null ? " (" + detail + ")" : "");
    }
}
