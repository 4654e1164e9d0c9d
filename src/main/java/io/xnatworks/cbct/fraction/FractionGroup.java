/*
 * XNAT CBCT Timeline
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.cbct.fraction;

import java.time.LocalDate;
import java.util.Collections;
import java.util.List;

/**
 * Sessions acquired on one calendar day.
 */
public final class FractionGroup {

    private final int index;
    private final LocalDate date;
    private final List<FractionEntry> entries;

    FractionGroup(int index, LocalDate date, List<FractionEntry> entries) {
        this.index = index;
        this.date = date;
        this.entries = Collections.unmodifiableList(entries);
    }

    /** Zero-based, in chronological order of dates. */
    public int getIndex() { return index; }

    public LocalDate getDate() { return date; }

    /**
     * One-based label used by export folder naming, e.g. {@code FX1} for index 0.
     */
    public String getLabel() {
        return "FX" + (index + 1);
    }

    public List<FractionEntry> getEntries() { return entries; }

    public int size() {
        return entries.size();
    }

    @Override
    public String toString() {
        return getLabel() + " " + date + " " + entries;
    }
}
