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
 * A session placed in the timeline.
 */
public final class FractionEntry {

    private final AcquisitionSession session;
    private final int fractionIndex;
    private final int intraFractionIndex;
    private final boolean eligible;

    FractionEntry(AcquisitionSession session, int fractionIndex, int intraFractionIndex, boolean eligible) {
        this.session = session;
        this.fractionIndex = fractionIndex;
        this.intraFractionIndex = intraFractionIndex;
        this.eligible = eligible;
    }

    public AcquisitionSession getSession() { return session; }

    /** Zero-based fraction index. */
    public int getFractionIndex() { return fractionIndex; }

    /** One-based position within the fraction, in timestamp order. */
    public int getIntraFractionIndex() { return intraFractionIndex; }

    /** Whether the session is in the transfer-eligible subset. */
    public boolean isEligible() { return eligible; }

    @Override
    public String toString() {
        return "FX" + (fractionIndex + 1) + "." + intraFractionIndex + " " + session.getScanId()
                + (eligible ? "" : " (ineligible)");
    }
}
