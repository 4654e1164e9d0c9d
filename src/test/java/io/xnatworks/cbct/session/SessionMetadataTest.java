/*
 * XNAT CBCT Timeline
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 */
package io.xnatworks.cbct.session;

import io.xnatworks.cbct.error.ArtifactNotFoundException;
import io.xnatworks.cbct.error.MalformedConfigException;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for ScanUidParser and FramesMetadataParser.
 */
@DisplayName("Session Metadata Tests")
class SessionMetadataTest {

    @TempDir
    Path tempDir;

    @Nested
    @DisplayName("Scan UID Tests")
    class ScanUidTests {

        @Test
        @DisplayName("Should parse timestamp suffix with milliseconds")
        void shouldParseSuffix() {
            LocalDateTime ts = ScanUidParser.parse("1.3.46.423632.33783920233217242713.224.2023-03-21165402768");

            assertEquals(LocalDateTime.of(2023, 3, 21, 16, 54, 2, 768_000_000), ts);
        }

        @Test
        @DisplayName("Should ignore surrounding whitespace")
        void shouldTrim() {
            assertEquals(LocalDateTime.of(2023, 3, 22, 9, 0, 0),
                    ScanUidParser.parse(" 1.2.3.2023-03-22090000000 "));
        }

        @Test
        @DisplayName("Should return null for UID without timestamp")
        void shouldReturnNullWithoutSuffix() {
            assertNull(ScanUidParser.parse("1.3.46.423632.33783920233217242713.224"));
            assertNull(ScanUidParser.parse(null));
        }

        @Test
        @DisplayName("Should return null for impossible date")
        void shouldReturnNullForInvalidDate() {
            assertNull(ScanUidParser.parse("1.2.3.2023-02-30120000000"));
            assertNull(ScanUidParser.parse("1.2.3.2023-03-21250000000"));
        }
    }

    @Nested
    @DisplayName("Frames Metadata Tests")
    class FramesTests {

        private final FramesMetadataParser parser = new FramesMetadataParser();

        @Test
        @DisplayName("Should read treatment and image fields")
        void shouldReadFields() throws Exception {
            FramesMetadata frames = parser.parse(
                    PatientTreeFixture.framesXml("WholeBrain-C2Retrt", "4ee Pelvis Fast", "1.3.46.1"));

            assertEquals("WholeBrain-C2Retrt", frames.getTreatmentId());
            assertEquals("4ee Pelvis Fast", frames.getAcquisitionPreset());
            assertEquals("1.3.46.1", frames.getDicomUid());
            assertEquals(120.0, frames.getTubeKv());
            assertEquals(20.0, frames.getTubeMa());
        }

        @Test
        @DisplayName("Missing elements are null")
        void missingElementsAreNull() throws Exception {
            FramesMetadata frames = parser.parse(PatientTreeFixture.framesXml(null, null, null));

            assertNull(frames.getTreatmentId());
            assertNull(frames.getAcquisitionPreset());
            assertNull(frames.getDicomUid());
        }

        @Test
        @DisplayName("Non-numeric tube values are ignored")
        void nonNumericTubeValues() throws Exception {
            FramesMetadata frames = parser.parse(
                    "<ProjectionSet><Image><kV>high</kV><mA>10</mA></Image></ProjectionSet>");

            assertNull(frames.getTubeKv());
            assertEquals(10.0, frames.getTubeMa());
        }

        @Test
        @DisplayName("Missing file is reported as not found")
        void missingFileIsNotFound() {
            assertThrows(ArtifactNotFoundException.class, () -> parser.parse(tempDir.resolve("_Frames.xml")));
        }

        @Test
        @DisplayName("Broken XML is reported as malformed")
        void brokenXmlIsMalformed() throws Exception {
            Path file = tempDir.resolve("_Frames.xml");
            Files.write(file, "<ProjectionSet><Image>".getBytes(StandardCharsets.UTF_8));

            assertThrows(MalformedConfigException.class, () -> parser.parse(file));
        }
    }
}
