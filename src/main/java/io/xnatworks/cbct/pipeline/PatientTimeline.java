/*
 * XNAT CBCT Timeline
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.cbct.pipeline;

import io.xnatworks.cbct.fraction.FractionTimeline;
import io.xnatworks.cbct.session.AcquisitionSession;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Everything reconstructed for one patient in one run: every discovered session, in
 * acquisition directory order, and the fraction timeline built from them.
 */
public final class PatientTimeline {

    private final Path patientRoot;
    private final List<AcquisitionSession> sessions;
    private final FractionTimeline timeline;

    public PatientTimeline(Path patientRoot, List<AcquisitionSession> sessions, FractionTimeline timeline) {
        this.patientRoot = patientRoot;
        this.sessions = Collections.unmodifiableList(new ArrayList<>(sessions));
        this.timeline = timeline;
    }

    public Path getPatientRoot() { return patientRoot; }
    public List<AcquisitionSession> getSessions() { return sessions; }
    public FractionTimeline getTimeline() { return timeline; }

    public List<AcquisitionSession> getDegradedSessions() {
        return sessions.stream().filter(AcquisitionSession::isDegraded).collect(Collectors.toList());
    }

    @Override
    public String toString() {
        return "PatientTimeline{" + patientRoot + ", sessions=" + sessions.size()
                + ", fractions=" + timeline.getFractionCount()
                + ", eligible=" + timeline.getEligible().size() + "}";
    }
}
