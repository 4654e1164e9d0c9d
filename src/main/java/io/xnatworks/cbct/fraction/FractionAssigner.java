/*
 * XNAT CBCT Timeline
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.cbct.fraction;

import io.xnatworks.cbct.session.AcquisitionSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * Builds the fraction timeline for one patient.
 *
 * Steps, in order:
 * 1. drop sessions with no timestamp or an unknown kind (reported, not placed)
 * 2. order by timestamp, then scan id
 * 3. one fraction per calendar date, indexed from 0 in date order
 * 4. 1-based index within each fraction
 * 5. mark entries eligible when their registration exists and was applied
 *
 * Stateless: every call is a pure function of its input.
 */
public class FractionAssigner {
    private static final Logger log = LoggerFactory.getLogger(FractionAssigner.class);

    static final Comparator<AcquisitionSession> CHRONOLOGICAL =
            Comparator.comparing(AcquisitionSession::getEffectiveTimestamp)
                    .thenComparing(AcquisitionSession::getScanId);

    public FractionTimeline assign(Collection<AcquisitionSession> sessions) {
        List<Exclusion> exclusions = new ArrayList<>();
        List<AcquisitionSession> usable = new ArrayList<>();

        for (AcquisitionSession session : sessions) {
            if (session.getEffectiveTimestamp() == null) {
                exclusions.add(new Exclusion(session, ExclusionReason.NO_TIMESTAMP, session.getDegradation()));
            } else if (!session.getKind().isAssignable()) {
                exclusions.add(new Exclusion(session, ExclusionReason.UNKNOWN_KIND, session.getAcquisitionPreset()));
            } else {
                usable.add(session);
            }
        }

        usable.sort(CHRONOLOGICAL);

        List<FractionGroup> fractions = new ArrayList<>();
        LocalDate currentDate = null;
        List<FractionEntry> currentEntries = null;
        for (AcquisitionSession session : usable) {
            LocalDate date = session.getEffectiveTimestamp().toLocalDate();
            if (!date.equals(currentDate)) {
                if (currentEntries != null) {
                    fractions.add(new FractionGroup(fractions.size(), currentDate, currentEntries));
                }
                currentDate = date;
                currentEntries = new ArrayList<>();
            }
            Exclusion ineligible = clinicalExclusion(session);
            if (ineligible != null) {
                exclusions.add(ineligible);
            }
            currentEntries.add(new FractionEntry(session, fractions.size(), currentEntries.size() + 1,
                    ineligible == null));
        }
        if (currentEntries != null) {
            fractions.add(new FractionGroup(fractions.size(), currentDate, currentEntries));
        }

        FractionTimeline timeline = new FractionTimeline(fractions, exclusions);
        log.info("Assigned {} session(s) to {} fraction(s); {} eligible, {} exclusion(s)",
                usable.size(), fractions.size(), timeline.getEligible().size(), exclusions.size());
        return timeline;
    }

    /**
     * Clinical inclusion rule: a registration record must exist, decode, and be applied.
     */
    static Exclusion clinicalExclusion(AcquisitionSession session) {
        if (!session.hasRegistration()) {
            if (session.hasRegistrationFile()) {
                return new Exclusion(session, ExclusionReason.REGISTRATION_UNREADABLE, session.getRegistrationError());
            }
            return new Exclusion(session, ExclusionReason.NO_REGISTRATION, null);
        }
        if (!session.getRegistration().isApplied()) {
            return new Exclusion(session, ExclusionReason.REGISTRATION_NOT_APPLIED, null);
        }
        return null;
    }
}
