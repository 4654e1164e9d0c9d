/*
 * XNAT CBCT Timeline
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 */
package io.xnatworks.cbct.config;

import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for AppConfig.
 */
@DisplayName("AppConfig Tests")
class AppConfigTest {

    @TempDir
    Path tempDir;

    @Nested
    @DisplayName("Default Values Tests")
    class DefaultValuesTests {

        @Test
        @DisplayName("Should have correct default layout settings")
        void shouldHaveDefaultLayout() {
            AppConfig config = new AppConfig();

            assertEquals("IMAGES", config.getImagesSubdir());
            assertEquals("img_.*", config.getAcquisitionDirPattern());
            assertEquals("_Frames.xml", config.getFramesFile());
            assertEquals("Reconstruction", config.getReconstructionSubdir());
            assertEquals(4, config.getWorkerThreads());
            assertFalse(config.isInferUndatedSessions());
            assertTrue(config.getClassificationRules().isEmpty());
        }

        @Test
        @DisplayName("Should have correct default registration settings")
        void shouldHaveDefaultRegistration() {
            AppConfig.RegistrationSettings registration = new AppConfig().getRegistration();

            assertEquals("(0021,103A)", registration.getTag());
            assertEquals(".INI.XVI", registration.getArchiveMemberSuffix());
            assertEquals("Align.clip1", registration.getAlignmentField());
            assertEquals("Align.mask1", registration.getMaskField());
            assertEquals("OnlineToRefTransformUnMatched", registration.getUnmatchedMatrixField());
            assertEquals("OnlineToRefTransformCorrection", registration.getCorrectionMatrixField());
        }

        @Test
        @DisplayName("Starter configuration carries the built-in vocabulary")
        void withDefaultsHasRules() {
            AppConfig config = AppConfig.withDefaults();

            assertEquals(AppConfig.ClassificationRuleConfig.defaults().size(), config.getClassificationRules().size());
            assertEquals("KIM_MOTION_VIEW", config.getClassificationRules().get(0).getKind());
        }
    }

    @Nested
    @DisplayName("YAML Loading Tests")
    class YamlLoadingTests {

        @Test
        @DisplayName("Should load config from YAML file")
        void shouldLoadConfigFromYaml() throws IOException {
            String yaml = """
                images_subdir: EXPORT
                acquisition_dir_pattern: "scan_\\\\d+"
                worker_threads: 2
                infer_undated_sessions: true
                registration:
                  tag: "(0021,1040)"
                  archive_member_suffix: .ini
                classification_rules:
                  - kind: cbct
                    match: token
                    pattern: cone
                """;

            File configFile = tempDir.resolve("config.yaml").toFile();
            Files.writeString(configFile.toPath(), yaml);

            AppConfig config = AppConfig.load(configFile);

            assertEquals("EXPORT", config.getImagesSubdir());
            assertEquals("scan_\\d+", config.getAcquisitionDirPattern());
            assertEquals(2, config.getWorkerThreads());
            assertTrue(config.isInferUndatedSessions());
            assertEquals("(0021,1040)", config.getRegistration().getTag());
            assertEquals(".ini", config.getRegistration().getArchiveMemberSuffix());
            assertEquals("Align.clip1", config.getRegistration().getAlignmentField());
            assertEquals(1, config.getClassificationRules().size());
            assertEquals("token", config.getClassificationRules().get(0).getMatch());
            assertEquals(configFile, config.getConfigFile());
        }

        @Test
        @DisplayName("Should ignore unknown keys")
        void shouldIgnoreUnknownKeys() throws IOException {
            File configFile = tempDir.resolve("config.yaml").toFile();
            Files.writeString(configFile.toPath(), "future_option: 1\nframes_file: frames.xml\n");

            assertEquals("frames.xml", AppConfig.load(configFile).getFramesFile());
        }

        @Test
        @DisplayName("Missing file yields defaults")
        void missingFileYieldsDefaults() throws IOException {
            AppConfig config = AppConfig.load(tempDir.resolve("absent.yaml").toString());

            assertEquals("IMAGES", config.getImagesSubdir());
            assertNull(config.getConfigFile());
        }
    }

    @Nested
    @DisplayName("Validation Tests")
    class ValidationTests {

        @Test
        @DisplayName("Worker threads are clamped to at least one")
        void clampsThreads() throws IOException {
            File configFile = tempDir.resolve("config.yaml").toFile();
            Files.writeString(configFile.toPath(), "worker_threads: 0\n");

            assertEquals(1, AppConfig.load(configFile).getWorkerThreads());
        }

        @Test
        @DisplayName("Empty acquisition pattern is rejected")
        void rejectsEmptyPattern() throws IOException {
            File configFile = tempDir.resolve("config.yaml").toFile();
            Files.writeString(configFile.toPath(), "acquisition_dir_pattern: \"\"\n");

            assertThrows(IOException.class, () -> AppConfig.load(configFile));
        }

        @Test
        @DisplayName("Null registration section falls back to defaults")
        void nullRegistrationSection() throws IOException {
            File configFile = tempDir.resolve("config.yaml").toFile();
            Files.writeString(configFile.toPath(), "registration:\n");

            assertEquals("(0021,103A)", AppConfig.load(configFile).getRegistration().getTag());
        }
    }

    @Nested
    @DisplayName("Save Tests")
    class SaveTests {

        @Test
        @DisplayName("Saved configuration loads back unchanged")
        void saveThenLoad() throws IOException {
            AppConfig original = AppConfig.withDefaults();
            original.setWorkerThreads(6);
            original.getRegistration().setMaskField("Align.mask2");
            File file = tempDir.resolve("saved.yaml").toFile();

            original.save(file);
            AppConfig loaded = AppConfig.load(file);

            assertEquals(6, loaded.getWorkerThreads());
            assertEquals("Align.mask2", loaded.getRegistration().getMaskField());
            assertEquals(original.getClassificationRules().size(), loaded.getClassificationRules().size());
            assertEquals("\\b[SML]\\d{2}\\b",
                    loaded.getClassificationRules().get(loaded.getClassificationRules().size() - 1).getPattern());
            String text = Files.readString(file.toPath());
            assertTrue(text.contains("images_subdir"));
            assertFalse(text.contains("config_file"));
            assertFalse(text.contains("configFile"));
        }
    }
}
