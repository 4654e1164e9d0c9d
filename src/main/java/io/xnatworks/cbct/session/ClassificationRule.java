/*
 * XNAT CBCT Timeline
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.cbct.session;

import io.xnatworks.cbct.config.AppConfig;

import java.util.Arrays;
import java.util.Locale;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Maps preset names matching a pattern to a session kind. Matching ignores case.
 */
public final class ClassificationRule {

    public enum MatchType {
        /** Substring of the preset name. */
        CONTAINS,
        /** Whole word, where words are separated by anything other than letters and digits. */
        TOKEN,
        /** Regular expression found anywhere in the preset name. */
        REGEX;

        public static MatchType fromString(String value) {
            if (value == null || value.isBlank()) {
                return CONTAINS;
            }
            try {
                return valueOf(value.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Unknown match type '" + value
                        + "' (expected contains, token or regex)", e);
            }
        }
    }

    private static final Pattern TOKEN_SEPARATOR = Pattern.compile("[^\\p{Alnum}]+");

    private final SessionKind kind;
    private final MatchType matchType;
    private final String pattern;
    private final Pattern regex;

    public ClassificationRule(SessionKind kind, MatchType matchType, String pattern) {
        if (kind == null || matchType == null || pattern == null || pattern.isEmpty()) {
            throw new IllegalArgumentException("kind, match type and pattern are required");
        }
        this.kind = kind;
        this.matchType = matchType;
        this.pattern = matchType == MatchType.REGEX ? pattern : pattern.toLowerCase(Locale.ROOT);
        if (matchType == MatchType.REGEX) {
            try {
                this.regex = Pattern.compile(pattern, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
            } catch (PatternSyntaxException e) {
                throw new IllegalArgumentException("Invalid classification regex '" + pattern + "'", e);
            }
        } else {
            this.regex = null;
        }
    }

    public static ClassificationRule contains(SessionKind kind, String text) {
        return new ClassificationRule(kind, MatchType.CONTAINS, text);
    }

    public static ClassificationRule token(SessionKind kind, String word) {
        return new ClassificationRule(kind, MatchType.TOKEN, word);
    }

    public static ClassificationRule regex(SessionKind kind, String expression) {
        return new ClassificationRule(kind, MatchType.REGEX, expression);
    }

    public static ClassificationRule fromConfig(AppConfig.ClassificationRuleConfig config) {
        return new ClassificationRule(SessionKind.fromString(config.getKind()),
                MatchType.fromString(config.getMatch()), config.getPattern());
    }

    public boolean matches(String presetName) {
        if (presetName == null) {
            return false;
        }
        switch (matchType) {
            case CONTAINS:
                return presetName.toLowerCase(Locale.ROOT).contains(pattern);
            case TOKEN:
                return Arrays.asList(TOKEN_SEPARATOR.split(presetName.toLowerCase(Locale.ROOT))).contains(pattern);
            case REGEX:
                return regex.matcher(presetName).find();
            default:
                return false;
        }
    }

    public SessionKind getKind() { return kind; }
    public MatchType getMatchType() { return matchType; }
    public String getPattern() { return pattern; }

    @Override
    public String toString() {
        return kind + " <- " + matchType.name().toLowerCase(Locale.ROOT) + ":" + pattern;
    }
}
