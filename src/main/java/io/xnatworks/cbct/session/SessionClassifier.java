/*
 * XNAT CBCT Timeline
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.cbct.session;

import io.xnatworks.cbct.config.AppConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Assigns a {@link SessionKind} from the acquisition preset name using an ordered rule list.
 * The first matching rule wins; presets no rule recognises are {@link SessionKind#UNKNOWN}.
 */
public class SessionClassifier {
    private static final Logger log = LoggerFactory.getLogger(SessionClassifier.class);

    private final List<ClassificationRule> rules;

    public SessionClassifier() {
        this(defaultRules());
    }

    public SessionClassifier(List<ClassificationRule> rules) {
        this.rules = Collections.unmodifiableList(new ArrayList<>(rules));
    }

    /**
     * Classifier from configured rules, or the built-in vocabulary when none are configured.
     */
    public static SessionClassifier fromConfig(AppConfig config) {
        List<AppConfig.ClassificationRuleConfig> configured = config.getClassificationRules();
        if (configured == null || configured.isEmpty()) {
            return new SessionClassifier();
        }
        List<ClassificationRule> rules = new ArrayList<>();
        for (AppConfig.ClassificationRuleConfig rule : configured) {
            rules.add(ClassificationRule.fromConfig(rule));
        }
        log.info("Using {} configured classification rules", rules.size());
        return new SessionClassifier(rules);
    }

    public static List<ClassificationRule> defaultRules() {
        List<ClassificationRule> rules = new ArrayList<>();
        for (AppConfig.ClassificationRuleConfig rule : AppConfig.ClassificationRuleConfig.defaults()) {
            rules.add(ClassificationRule.fromConfig(rule));
        }
        return rules;
    }

    public List<ClassificationRule> getRules() {
        return rules;
    }

    public SessionKind classify(String presetName) {
        if (presetName == null || presetName.isBlank()) {
            return SessionKind.UNKNOWN;
        }
        for (ClassificationRule rule : rules) {
            if (rule.matches(presetName)) {
                return rule.getKind();
            }
        }
        return SessionKind.UNKNOWN;
    }

    /**
     * Classify and annotate a session. Unrecognised presets get a warning; the session is kept.
     */
    public SessionKind classify(AcquisitionSession session) {
        SessionKind kind = classify(session.getAcquisitionPreset());
        session.setKind(kind);
        if (kind == SessionKind.UNKNOWN) {
            String preset = session.getAcquisitionPreset();
            String warning = preset == null || preset.isBlank()
                    ? "No acquisition preset; session kind unknown"
                    : "Unrecognised acquisition preset '" + preset + "'";
            session.addWarning(warning);
            log.warn("[{}] {}", session.getDirectoryName(), warning);
        } else {
            log.debug("[{}] Preset '{}' classified as {}", session.getDirectoryName(),
                    session.getAcquisitionPreset(), kind);
        }
        return kind;
    }
}
