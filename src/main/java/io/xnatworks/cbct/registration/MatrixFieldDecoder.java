/*
 * XNAT CBCT Timeline
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.cbct.registration;

import io.xnatworks.cbct.error.ArtifactNotFoundException;
import io.xnatworks.cbct.error.MalformedMatrixException;

import java.util.regex.Pattern;

/**
 * Decodes numeric vector fields of a parsed registration member.
 * Counts are strict: a field with too few or too many values, or a non-finite
 * token, is rejected rather than padded or truncated.
 */
public class MatrixFieldDecoder {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern COMMA = Pattern.compile(",");

    public Transform4x4 decodeTransform(KeyValueConfig config, String field)
            throws ArtifactNotFoundException, MalformedMatrixException {
        String raw = require(config, field);
        return new Transform4x4(parseValues(field, raw, WHITESPACE, Transform4x4.ELEMENT_COUNT));
    }

    public AlignmentTuple decodeAlignment(KeyValueConfig config, String field)
            throws ArtifactNotFoundException, MalformedMatrixException {
        String raw = require(config, field);
        Pattern separator = raw.indexOf(',') >= 0 ? COMMA : WHITESPACE;
        return AlignmentTuple.of(parseValues(field, raw, separator, AlignmentTuple.VALUE_COUNT));
    }

    /**
     * Parse a 16-value row-major field string directly.
     */
    public Transform4x4 parseTransform(String raw) throws MalformedMatrixException {
        return new Transform4x4(parseValues("transform", raw, WHITESPACE, Transform4x4.ELEMENT_COUNT));
    }

    private static String require(KeyValueConfig config, String field) throws ArtifactNotFoundException {
        String raw = config.get(field);
        if (raw == null || raw.isBlank()) {
            throw new ArtifactNotFoundException("Field '" + field + "' not present");
        }
        return raw;
    }

    static double[] parseValues(String field, String raw, Pattern separator, int expected)
            throws MalformedMatrixException {
        String trimmed = raw == null ? "" : raw.trim();
        // Comma fields keep empty tokens so doubled or trailing commas count against the total
        String[] tokens = trimmed.isEmpty() ? new String[0] : separator.split(trimmed, -1);
        if (tokens.length != expected) {
            throw new MalformedMatrixException("Field '" + field + "' has " + tokens.length
                    + " values, expected " + expected);
        }
        for (int i = 0; i < tokens.length; i++) {
            tokens[i] = tokens[i].trim();
            if (tokens[i].isEmpty()) {
                throw new MalformedMatrixException("Field '" + field + "' value " + (i + 1) + " is empty");
            }
        }
        double[] values = new double[expected];
        for (int i = 0; i < expected; i++) {
            try {
                values[i] = Double.parseDouble(tokens[i]);
            } catch (NumberFormatException e) {
                throw new MalformedMatrixException("Field '" + field + "' value " + (i + 1)
                        + " is not numeric: " + tokens[i], e);
            }
            if (!Double.isFinite(values[i])) {
                throw new MalformedMatrixException("Field '" + field + "' value " + (i + 1)
                        + " is not finite: " + tokens[i]);
            }
        }
        return values;
    }
}
