/*
 * XNAT CBCT Timeline
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 */
package io.xnatworks.cbct.session;

import io.xnatworks.cbct.config.AppConfig;
import io.xnatworks.cbct.error.PreconditionException;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for AcquisitionScanner.
 */
@DisplayName("AcquisitionScanner Tests")
class AcquisitionScannerTest {

    @TempDir
    Path tempDir;

    private PatientTreeFixture tree;
    private AcquisitionScanner scanner;

    @BeforeEach
    void setUp() {
        tree = new PatientTreeFixture(tempDir.resolve("patient"));
        scanner = new AcquisitionScanner(new AppConfig());
    }

    @Nested
    @DisplayName("Discovery Tests")
    class DiscoveryTests {

        @Test
        @DisplayName("Should list matching acquisition directories sorted by name")
        void shouldListSorted() throws Exception {
            tree.acquisition("img_300").write();
            tree.acquisition("img_100").write();
            tree.acquisition("img_200").write();
            Files.createDirectories(tree.imagesDir().resolve("PLANS"));
            Files.write(tree.imagesDir().resolve("img_file"), new byte[0]);

            List<Path> dirs = scanner.listAcquisitionDirectories(tree.getRoot());

            assertEquals(3, dirs.size());
            assertEquals("img_100", dirs.get(0).getFileName().toString());
            assertEquals("img_200", dirs.get(1).getFileName().toString());
            assertEquals("img_300", dirs.get(2).getFileName().toString());
        }

        @Test
        @DisplayName("Missing patient root is a precondition failure")
        void missingRootFails() {
            assertThrows(PreconditionException.class,
                    () -> scanner.listAcquisitionDirectories(tempDir.resolve("nobody")));
        }

        @Test
        @DisplayName("Missing images directory is a precondition failure")
        void missingImagesDirFails() throws Exception {
            Files.createDirectories(tree.getRoot());

            assertThrows(PreconditionException.class, () -> scanner.listAcquisitionDirectories(tree.getRoot()));
        }

        @Test
        @DisplayName("Empty images subdirectory setting scans the root itself")
        void emptySubdirScansRoot() throws Exception {
            Files.createDirectories(tempDir.resolve("flat/img_1"));
            AppConfig config = new AppConfig();
            config.setImagesSubdir("");

            List<Path> dirs = new AcquisitionScanner(config).listAcquisitionDirectories(tempDir.resolve("flat"));

            assertEquals(1, dirs.size());
        }
    }

    @Nested
    @DisplayName("Acquisition Reading Tests")
    class ReadingTests {

        @Test
        @DisplayName("Should read scan id, timestamp and frame metadata")
        void shouldReadMetadata() throws Exception {
            Path dir = tree.acquisition("img_1")
                    .treatment("WholeBrain-C2Retrt")
                    .preset("4ee Pelvis Fast")
                    .scannedAt("2023-03-21", "165402")
                    .registration(PatientTreeFixture.APPLIED_CLIP)
                    .write();

            AcquisitionSession session = scanner.readAcquisition(dir).build();

            assertEquals(PatientTreeFixture.scanUid("2023-03-21", "165402"), session.getScanId());
            assertEquals(LocalDateTime.of(2023, 3, 21, 16, 54, 2), session.getScanTimestamp());
            assertEquals("WholeBrain-C2Retrt", session.getTreatmentId());
            assertEquals("4ee Pelvis Fast", session.getAcquisitionPreset());
            assertEquals(120.0, session.getTubeKv());
            assertEquals(20.0, session.getTubeMa());
            assertEquals("reg.RPS.dcm", session.getRegistrationFile().getFileName().toString());
            assertFalse(session.isDegraded());
        }

        @Test
        @DisplayName("Missing frame metadata degrades the session")
        void missingFramesDegrades() throws Exception {
            Path dir = tree.acquisition("img_2").noFrames().scannedAt("2023-03-21", "090000").write();

            AcquisitionSession session = scanner.readAcquisition(dir).build();

            assertTrue(session.isDegraded());
            assertTrue(session.getDegradation().contains("_Frames.xml"));
            assertNull(session.getAcquisitionPreset());
            assertEquals("WholeBrain", session.getTreatmentId());
            assertEquals(100.0, session.getTubeKv());
        }

        @Test
        @DisplayName("Without a scan configuration the frame UID becomes the scan id")
        void frameUidFallback() throws Exception {
            Path dir = tree.acquisition("img_3").preset("MotionView").dicomUid("1.3.46.99").write();

            AcquisitionSession session = scanner.readAcquisition(dir).build();

            assertEquals("1.3.46.99", session.getScanId());
            assertNull(session.getScanTimestamp());
            assertFalse(session.hasRegistrationFile());
        }

        @Test
        @DisplayName("Directory name is the last resort scan id")
        void directoryNameFallback() throws Exception {
            Path dir = tree.acquisition("img_4").noFrames().write();

            assertEquals("img_4", scanner.readAcquisition(dir).build().getScanId());
        }

        @Test
        @DisplayName("Registration record is preferred over other DICOM files")
        void prefersRegistrationRecord() throws Exception {
            Path dir = tree.acquisition("img_5").write();
            Path recon = dir.resolve("Reconstruction");
            Files.write(recon.resolve("a_image.dcm"), new byte[0]);
            Files.write(recon.resolve("z_reg.RPS.dcm"), new byte[0]);

            assertEquals("z_reg.RPS.dcm", scanner.findRegistrationFile(dir).getFileName().toString());

            Files.delete(recon.resolve("z_reg.RPS.dcm"));
            assertEquals("a_image.dcm", scanner.findRegistrationFile(dir).getFileName().toString());
        }

        @Test
        @DisplayName("Unparseable frame metadata degrades but does not fail")
        void brokenFramesDegrades() throws Exception {
            Path dir = tree.acquisition("img_6").noFrames().write();
            Files.write(dir.resolve("_Frames.xml"), "<ProjectionSet>".getBytes(StandardCharsets.UTF_8));

            AcquisitionSession session = scanner.readAcquisition(dir).build();

            assertTrue(session.getDegradation().startsWith("unreadable _Frames.xml"));
        }
    }
}
