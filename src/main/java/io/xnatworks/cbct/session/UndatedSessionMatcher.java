/*
 * XNAT CBCT Timeline
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.cbct.session;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Infers a date for sessions without a scan timestamp, typically MotionView acquisitions
 * which have no reconstruction.
 *
 * Acquisition directory names are sequential UIDs, so name order follows acquisition order.
 * An undated session borrows the timestamp of the nearest dated session by name position,
 * preferring dated sessions with the same treatment identifier. Ties go to the earlier one.
 */
public class UndatedSessionMatcher {
    private static final Logger log = LoggerFactory.getLogger(UndatedSessionMatcher.class);

    /**
     * @return number of sessions that received an inferred timestamp
     */
    public int match(List<AcquisitionSession> sessions) {
        List<AcquisitionSession> dated = new ArrayList<>();
        List<AcquisitionSession> undated = new ArrayList<>();
        for (AcquisitionSession session : sessions) {
            if (session.getScanTimestamp() != null) {
                dated.add(session);
            } else if (session.getKind().isAssignable()) {
                undated.add(session);
            }
        }
        if (dated.isEmpty() || undated.isEmpty()) {
            return 0;
        }

        List<String> names = new ArrayList<>();
        for (AcquisitionSession session : sessions) {
            names.add(session.getDirectoryName());
        }
        names.sort(null);
        Map<String, Integer> position = new HashMap<>();
        for (int i = 0; i < names.size(); i++) {
            position.putIfAbsent(names.get(i), i);
        }

        int matched = 0;
        for (AcquisitionSession session : undated) {
            int pos = position.get(session.getDirectoryName());
            AcquisitionSession best = null;
            String treatment = session.getTreatmentId();
            if (treatment != null && !treatment.isBlank()) {
                best = nearest(dated, position, pos, treatment.trim());
            }
            if (best == null) {
                best = nearest(dated, position, pos, null);
            }
            session.setInferredTimestamp(best.getScanTimestamp(), best.getDirectoryName());
            session.addWarning("Scan time inferred from " + best.getDirectoryName());
            log.info("[{}] Matched undated session to {} (treatment={}, date={})",
                    session.getDirectoryName(), best.getDirectoryName(), best.getTreatmentId(),
                    best.getScanTimestamp().toLocalDate());
            matched++;
        }
        return matched;
    }

    private static AcquisitionSession nearest(List<AcquisitionSession> dated, Map<String, Integer> position,
                                              int pos, String treatment) {
        AcquisitionSession best = null;
        int bestDistance = Integer.MAX_VALUE;
        int bestPos = Integer.MAX_VALUE;
        for (AcquisitionSession candidate : dated) {
            if (treatment != null) {
                String candidateTreatment = candidate.getTreatmentId();
                if (candidateTreatment == null || !candidateTreatment.trim().equals(treatment)) {
                    continue;
                }
            }
            int candidatePos = position.get(candidate.getDirectoryName());
            int distance = Math.abs(candidatePos - pos);
            if (distance < bestDistance || (distance == bestDistance && candidatePos < bestPos)) {
                best = candidate;
                bestDistance = distance;
                bestPos = candidatePos;
            }
        }
        return best;
    }
}
