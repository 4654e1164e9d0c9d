/*
 * XNAT CBCT Timeline
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.cbct.registration;

import io.xnatworks.cbct.error.MalformedConfigException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Parsed contents of a vendor {@code key=value} text file.
 * Keys are flat: section headers are recorded but do not qualify the keys below them.
 */
public final class KeyValueConfig {

    private final Map<String, String> values;
    private final Map<String, List<String>> allValues;
    private final List<String> sections;
    private final int malformedLineCount;

    KeyValueConfig(Map<String, List<String>> allValues, List<String> sections, int malformedLineCount) {
        Map<String, String> last = new LinkedHashMap<>();
        Map<String, List<String>> all = new LinkedHashMap<>();
        for (Map.Entry<String, List<String>> entry : allValues.entrySet()) {
            List<String> list = entry.getValue();
            last.put(entry.getKey(), list.get(list.size() - 1));
            all.put(entry.getKey(), Collections.unmodifiableList(new ArrayList<>(list)));
        }
        this.values = Collections.unmodifiableMap(last);
        this.allValues = Collections.unmodifiableMap(all);
        this.sections = Collections.unmodifiableList(new ArrayList<>(sections));
        this.malformedLineCount = malformedLineCount;
    }

    /**
     * Value of the last occurrence of {@code key}, or {@code null}.
     */
    public String get(String key) {
        return values.get(key);
    }

    /**
     * Every value recorded for {@code key} in file order.
     */
    public List<String> getAll(String key) {
        List<String> list = allValues.get(key);
        return list == null ? Collections.emptyList() : list;
    }

    public boolean contains(String key) {
        return values.containsKey(key);
    }

    /**
     * Numeric value of {@code key}.
     *
     * @return the parsed value, or {@code null} if the key is absent or blank
     * @throws MalformedConfigException if the value is present but not a number
     */
    public Double getDouble(String key) throws MalformedConfigException {
        String raw = values.get(key);
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return Double.valueOf(raw.trim());
        } catch (NumberFormatException e) {
            throw new MalformedConfigException("Value of '" + key + "' is not numeric: " + raw, e);
        }
    }

    public Set<String> keys() {
        return values.keySet();
    }

    public Map<String, String> asMap() {
        return values;
    }

    public List<String> getSections() { return sections; }

    public int getMalformedLineCount() { return malformedLineCount; }

    public int size() {
        return values.size();
    }

    @Override
    public String toString() {
        return "KeyValueConfig{keys=" + values.size() + ", sections=" + sections
                + ", malformedLines=" + malformedLineCount + "}";
    }
}
