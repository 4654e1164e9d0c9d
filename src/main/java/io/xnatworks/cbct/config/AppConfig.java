/*
 * XNAT CBCT Timeline
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.cbct.config;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Application configuration for CBCT timeline reconstruction.
 * Describes:
 * - the layout of a patient export tree
 * - where the registration archive lives in a registration record
 * - the preset vocabulary used to classify acquisitions
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class AppConfig {
    private static final Logger log = LoggerFactory.getLogger(AppConfig.class);

    /**
     * Subdirectory of the patient root holding acquisitions. Empty means the root itself.
     */
    @JsonProperty("images_subdir")
    private String imagesSubdir = "IMAGES";

    /**
     * Regex an acquisition directory name must match.
     */
    @JsonProperty("acquisition_dir_pattern")
    private String acquisitionDirPattern = "img_.*";

    @JsonProperty("frames_file")
    private String framesFile = "_Frames.xml";

    @JsonProperty("reconstruction_subdir")
    private String reconstructionSubdir = "Reconstruction";

    /**
     * Number of acquisitions processed concurrently.
     */
    @JsonProperty("worker_threads")
    private int workerThreads = 4;

    /**
     * Infer dates for acquisitions without a scan timestamp from their neighbours.
     */
    @JsonProperty("infer_undated_sessions")
    private boolean inferUndatedSessions = false;

    private RegistrationSettings registration = new RegistrationSettings();

    /**
     * Ordered preset rules. First match wins; empty means the built-in vocabulary.
     */
    @JsonProperty("classification_rules")
    private List<ClassificationRuleConfig> classificationRules = new ArrayList<>();

    private transient File configFile;

    public static AppConfig load(File configFile) throws IOException {
        if (!configFile.exists()) {
            log.info("Configuration {} not found, using defaults", configFile.getAbsolutePath());
            return new AppConfig();
        }
        log.info("Loading configuration from: {}", configFile.getAbsolutePath());
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        AppConfig config = mapper.readValue(configFile, AppConfig.class);
        config.configFile = configFile;
        config.validate();
        return config;
    }

    public static AppConfig load(String configPath) throws IOException {
        return load(new File(configPath));
    }

    /**
     * Save the configuration to a specific file.
     */
    public void save(File file) throws IOException {
        log.info("Saving configuration to: {}", file.getAbsolutePath());
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        mapper.writerWithDefaultPrettyPrinter().writeValue(file, this);
    }

    /**
     * Configuration populated with the built-in classification vocabulary, for writing a starter file.
     */
    public static AppConfig withDefaults() {
        AppConfig config = new AppConfig();
        config.setClassificationRules(ClassificationRuleConfig.defaults());
        return config;
    }

    private void validate() throws IOException {
        if (workerThreads < 1) {
            log.warn("worker_threads must be at least 1, was {}; using 1", workerThreads);
            workerThreads = 1;
        }
        if (registration == null) {
            registration = new RegistrationSettings();
        }
        if (classificationRules == null) {
            classificationRules = new ArrayList<>();
        }
        if (acquisitionDirPattern == null || acquisitionDirPattern.isBlank()) {
            throw new IOException("acquisition_dir_pattern must not be empty");
        }
    }

    @JsonIgnore
    public File getConfigFile() { return configFile; }

    public String getImagesSubdir() { return imagesSubdir; }
    public void setImagesSubdir(String imagesSubdir) { this.imagesSubdir = imagesSubdir; }

    public String getAcquisitionDirPattern() { return acquisitionDirPattern; }
    public void setAcquisitionDirPattern(String acquisitionDirPattern) { this.acquisitionDirPattern = acquisitionDirPattern; }

    public String getFramesFile() { return framesFile; }
    public void setFramesFile(String framesFile) { this.framesFile = framesFile; }

    public String getReconstructionSubdir() { return reconstructionSubdir; }
    public void setReconstructionSubdir(String reconstructionSubdir) { this.reconstructionSubdir = reconstructionSubdir; }

    public int getWorkerThreads() { return workerThreads; }
    public void setWorkerThreads(int workerThreads) { this.workerThreads = workerThreads; }

    public boolean isInferUndatedSessions() { return inferUndatedSessions; }
    public void setInferUndatedSessions(boolean inferUndatedSessions) { this.inferUndatedSessions = inferUndatedSessions; }

    public RegistrationSettings getRegistration() { return registration; }
    public void setRegistration(RegistrationSettings registration) { this.registration = registration; }

    public List<ClassificationRuleConfig> getClassificationRules() { return classificationRules; }
    public void setClassificationRules(List<ClassificationRuleConfig> classificationRules) { this.classificationRules = classificationRules; }

    /**
     * Location of the registration archive and the names of its fields.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class RegistrationSettings {
        /**
         * Private element holding the zip archive, as {@code (gggg,eeee)}.
         */
        private String tag = "(0021,103A)";

        @JsonProperty("archive_member_suffix")
        private String archiveMemberSuffix = ".INI.XVI";

        @JsonProperty("alignment_field")
        private String alignmentField = "Align.clip1";

        @JsonProperty("mask_field")
        private String maskField = "Align.mask1";

        @JsonProperty("unmatched_matrix_field")
        private String unmatchedMatrixField = "OnlineToRefTransformUnMatched";

        @JsonProperty("correction_matrix_field")
        private String correctionMatrixField = "OnlineToRefTransformCorrection";

        public String getTag() { return tag; }
        public void setTag(String tag) { this.tag = tag; }

        public String getArchiveMemberSuffix() { return archiveMemberSuffix; }
        public void setArchiveMemberSuffix(String archiveMemberSuffix) { this.archiveMemberSuffix = archiveMemberSuffix; }

        public String getAlignmentField() { return alignmentField; }
        public void setAlignmentField(String alignmentField) { this.alignmentField = alignmentField; }

        public String getMaskField() { return maskField; }
        public void setMaskField(String maskField) { this.maskField = maskField; }

        public String getUnmatchedMatrixField() { return unmatchedMatrixField; }
        public void setUnmatchedMatrixField(String unmatchedMatrixField) { this.unmatchedMatrixField = unmatchedMatrixField; }

        public String getCorrectionMatrixField() { return correctionMatrixField; }
        public void setCorrectionMatrixField(String correctionMatrixField) { this.correctionMatrixField = correctionMatrixField; }
    }

    /**
     * One preset classification rule.
     * {@code match} is {@code contains} (substring), {@code token} (whole word) or {@code regex}.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ClassificationRuleConfig {
        private String kind;
        private String match = "contains";
        private String pattern;

        public ClassificationRuleConfig() {
        }

        public ClassificationRuleConfig(String kind, String match, String pattern) {
            this.kind = kind;
            this.match = match;
            this.pattern = pattern;
        }

        public static List<ClassificationRuleConfig> defaults() {
            List<ClassificationRuleConfig> rules = new ArrayList<>();
            rules.add(new ClassificationRuleConfig("KIM_MOTION_VIEW", "contains", "motionview"));
            rules.add(new ClassificationRuleConfig("KIM_MOTION_VIEW", "contains", "motion view"));
            rules.add(new ClassificationRuleConfig("KIM_LEARNING", "contains", "kim"));
            rules.add(new ClassificationRuleConfig("CBCT", "token", "cbct"));
            rules.add(new ClassificationRuleConfig("CBCT", "token", "xvi"));
            for (String word : new String[] {"pelvis", "prostate", "head", "neck", "chest", "thorax",
                    "lung", "abdomen", "breast", "spine"}) {
                rules.add(new ClassificationRuleConfig("CBCT", "contains", word));
            }
            rules.add(new ClassificationRuleConfig("CBCT", "regex", "\\b[SML]\\d{2}\\b"));
            return rules;
        }

        public String getKind() { return kind; }
        public void setKind(String kind) { this.kind = kind; }

        public String getMatch() { return match; }
        public void setMatch(String match) { this.match = match; }

        public String getPattern() { return pattern; }
        public void setPattern(String pattern) { this.pattern = pattern; }

        @Override
        public String toString() {
            return kind + " <- " + match + ":" + pattern;
        }
    }
}
