/*
 * XNAT CBCT Timeline
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.cbct.registration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parser for the vendor's flat {@code key=value} dialect, used by both the scan
 * configuration files ({@code *.INI}) and the archived registration member
 * ({@code *.INI.XVI}).
 *
 * Malformed lines are skipped and counted. The parser never fails.
 */
public class KeyValueConfigParser {
    private static final Logger log = LoggerFactory.getLogger(KeyValueConfigParser.class);

    public KeyValueConfig parse(String text) {
        Map<String, List<String>> entries = new LinkedHashMap<>();
        List<String> sections = new ArrayList<>();
        int malformed = 0;

        if (text == null) {
            return new KeyValueConfig(entries, sections, 0);
        }

        String[] lines = text.split("\\r?\\n|\\r");
        for (int i = 0; i < lines.length; i++) {
            String line = lines[i].trim();
            if (line.isEmpty() || line.startsWith(";") || line.startsWith("#")) {
                continue;
            }
            if (line.startsWith("[") && line.endsWith("]")) {
                sections.add(line.substring(1, line.length() - 1).trim());
                continue;
            }
            int eq = line.indexOf('=');
            if (eq < 0) {
                log.debug("Skipping line {} without '=': {}", i + 1, line);
                malformed++;
                continue;
            }
            String key = line.substring(0, eq).trim();
            if (key.isEmpty()) {
                log.debug("Skipping line {} with empty key", i + 1);
                malformed++;
                continue;
            }
            String value = line.substring(eq + 1).trim();
            entries.computeIfAbsent(key, k -> new ArrayList<>()).add(value);
        }

        if (malformed > 0) {
            log.warn("Skipped {} malformed line(s) while parsing key=value text", malformed);
        }
        return new KeyValueConfig(entries, sections, malformed);
    }

    public KeyValueConfig parse(byte[] data) {
        return parse(new String(data, StandardCharsets.UTF_8));
    }

    public KeyValueConfig parse(Path file) throws IOException {
        return parse(Files.readAllBytes(file));
    }
}
