/*
 * XNAT CBCT Timeline
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 */
package io.xnatworks.cbct;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.xnatworks.cbct.dicom.DicomTestFiles;
import io.xnatworks.cbct.session.PatientTreeFixture;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Command line tests for CbctTimeline.
 */
@DisplayName("CbctTimeline CLI Tests")
class CbctTimelineTest {

    @TempDir
    Path tempDir;

    private StringWriter out;
    private StringWriter err;
    private CommandLine cli;

    @BeforeEach
    void setUp() {
        out = new StringWriter();
        err = new StringWriter();
        cli = new CommandLine(new CbctTimeline());
        cli.setOut(new PrintWriter(out));
        cli.setErr(new PrintWriter(err));
    }

    private int run(String... args) {
        String[] withConfig = new String[args.length + 2];
        withConfig[0] = "--config";
        withConfig[1] = tempDir.resolve("no-such-config.yaml").toString();
        System.arraycopy(args, 0, withConfig, 2, args.length);
        return cli.execute(withConfig);
    }

    private Path writePatient() throws Exception {
        PatientTreeFixture tree = new PatientTreeFixture(tempDir.resolve("patient"));
        tree.acquisition("img_1").scannedAt("2023-03-21", "090000")
                .registration(PatientTreeFixture.APPLIED_CLIP).write();
        tree.acquisition("img_2").scannedAt("2023-03-22", "090000")
                .registration(PatientTreeFixture.ZERO_CLIP).write();
        return tree.getRoot();
    }

    @Nested
    @DisplayName("Scan Command Tests")
    class ScanCommandTests {

        @Test
        @DisplayName("Should print the fraction summary")
        void shouldPrintSummary() throws Exception {
            Path root = writePatient();

            int exit = run("scan", root.toString(), "--threads", "2");

            assertEquals(0, exit);
            String text = out.toString();
            assertTrue(text.contains("FX1"));
            assertTrue(text.contains("FX2"));
            assertTrue(text.contains("2023-03-21 09:00:00"));
            assertTrue(text.contains("REGISTRATION_NOT_APPLIED"));
            assertTrue(text.contains("2 session(s), 2 fraction(s), 1 eligible"));
        }

        @Test
        @DisplayName("Should print JSON and write the report file")
        void shouldPrintJson() throws Exception {
            Path root = writePatient();
            Path report = tempDir.resolve("report.json");

            int exit = run("scan", root.toString(), "--json", "-o", report.toString());

            assertEquals(0, exit);
            ObjectMapper mapper = new ObjectMapper();
            JsonNode printed = mapper.readTree(out.toString());
            assertEquals(2, printed.get("fraction_count").asInt());
            assertTrue(Files.exists(report));
            assertEquals(1, mapper.readTree(report.toFile()).get("eligible_scan_ids").size());
        }

        @Test
        @DisplayName("Missing patient root exits with the precondition code")
        void missingRoot() {
            int exit = run("scan", tempDir.resolve("missing").toString());

            assertEquals(CbctTimeline.EXIT_PRECONDITION, exit);
            assertTrue(err.toString().contains("Patient root is not a directory"));
        }
    }

    @Nested
    @DisplayName("Shifts Command Tests")
    class ShiftsCommandTests {

        @Test
        @DisplayName("Should print the reconciled shifts")
        void shouldPrintShifts() throws Exception {
            Path file = DicomTestFiles.writeRegistrationRecord(tempDir.resolve("reg.RPS.dcm"), "a.INI.XVI",
                    DicomTestFiles.registrationIni(PatientTreeFixture.APPLIED_CLIP, null, null));

            int exit = run("shifts", file.toString());

            assertEquals(0, exit);
            String text = out.toString();
            assertTrue(text.contains("Protocol:     Bone (T+R)"));
            assertTrue(text.contains("Aligned at:   2023-03-21 16:58:10"));
            assertTrue(text.contains("Coronal"));
            assertTrue(text.contains("Applied:     yes"));
        }

        @Test
        @DisplayName("Undecodable record exits with the data error code")
        void undecodableRecord() throws Exception {
            Path file = tempDir.resolve("bad.RPS.dcm");
            Files.write(file, DicomTestFiles.registrationRecord(new byte[] { 0, 1, 2, 3 }));

            assertEquals(CbctTimeline.EXIT_DATA_ERROR, run("shifts", file.toString()));
            assertTrue(err.toString().startsWith("Error:"));
        }
    }

    @Nested
    @DisplayName("Config Command Tests")
    class ConfigCommandTests {

        @Test
        @DisplayName("Should write a starter configuration")
        void shouldWriteConfig() throws Exception {
            Path target = tempDir.resolve("starter.yaml");

            assertEquals(0, run("config", "-o", target.toString()));
            String yaml = Files.readString(target);
            assertTrue(yaml.contains("classification_rules"));
            assertTrue(yaml.contains("archive_member_suffix"));
        }

        @Test
        @DisplayName("Should refuse to overwrite without force")
        void shouldRefuseOverwrite() throws Exception {
            Path target = tempDir.resolve("starter.yaml");
            Files.writeString(target, "worker_threads: 2\n");

            assertEquals(1, run("config", "-o", target.toString()));
            assertEquals("worker_threads: 2\n", Files.readString(target));

            assertEquals(0, run("config", "-o", target.toString(), "--force"));
            assertNotEquals("worker_threads: 2\n", Files.readString(target));
        }
    }
}
