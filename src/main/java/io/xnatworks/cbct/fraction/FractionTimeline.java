/*
 * XNAT CBCT Timeline
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.cbct.fraction;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Result of fraction assignment for one patient: the full ordered timeline, the
 * transfer-eligible subset and the exclusion report.
 */
public final class FractionTimeline {

    private final List<FractionGroup> fractions;
    private final List<Exclusion> exclusions;

    FractionTimeline(List<FractionGroup> fractions, List<Exclusion> exclusions) {
        this.fractions = Collections.unmodifiableList(new ArrayList<>(fractions));
        this.exclusions = Collections.unmodifiableList(new ArrayList<>(exclusions));
    }

    public List<FractionGroup> getFractions() { return fractions; }

    public List<Exclusion> getExclusions() { return exclusions; }

    /**
     * Every timeline entry in order, eligible or not.
     */
    public List<FractionEntry> getEntries() {
        List<FractionEntry> all = new ArrayList<>();
        for (FractionGroup group : fractions) {
            all.addAll(group.getEntries());
        }
        return all;
    }

    /**
     * Entries handed to export: registration present and applied.
     */
    public List<FractionEntry> getEligible() {
        return getEntries().stream().filter(FractionEntry::isEligible).collect(Collectors.toList());
    }

    public int getFractionCount() {
        return fractions.size();
    }
}
