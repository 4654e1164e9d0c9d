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

import java.time.DateTimeException;
import java.time.LocalDateTime;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts the acquisition time embedded at the end of a scan UID, e.g.
 * {@code 1.3.46.423632.33783920233217242713.224.2023-03-21165402768} is 2023-03-21 16:54:02.768.
 */
public final class ScanUidParser {
    private static final Logger log = LoggerFactory.getLogger(ScanUidParser.class);

    private static final Pattern TIMESTAMP_SUFFIX = Pattern.compile(
            "(\\d{4})-(\\d{2})-(\\d{2})(\\d{2})(\\d{2})(\\d{2})(\\d{3})$");

    private ScanUidParser() {
    }

    /**
     * @return the embedded timestamp, or {@code null} if the UID carries none or it is not a valid date
     */
    public static LocalDateTime parse(String scanUid) {
        if (scanUid == null) {
            return null;
        }
        Matcher m = TIMESTAMP_SUFFIX.matcher(scanUid.trim());
        if (!m.find()) {
            log.warn("Scan UID has no timestamp suffix: {}", scanUid);
            return null;
        }
        try {
            return LocalDateTime.of(
                    Integer.parseInt(m.group(1)),
                    Integer.parseInt(m.group(2)),
                    Integer.parseInt(m.group(3)),
                    Integer.parseInt(m.group(4)),
                    Integer.parseInt(m.group(5)),
                    Integer.parseInt(m.group(6)),
                    Integer.parseInt(m.group(7)) * 1_000_000);
        } catch (DateTimeException e) {
            log.warn("Scan UID {} has an invalid timestamp: {}", scanUid, e.getMessage());
            return null;
        }
    }
}
