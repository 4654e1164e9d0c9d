/*
 * XNAT CBCT Timeline
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.cbct;

import io.xnatworks.cbct.config.AppConfig;
import io.xnatworks.cbct.error.CbctDataException;
import io.xnatworks.cbct.error.PreconditionException;
import io.xnatworks.cbct.fraction.Exclusion;
import io.xnatworks.cbct.fraction.FractionEntry;
import io.xnatworks.cbct.fraction.FractionGroup;
import io.xnatworks.cbct.pipeline.PatientTimeline;
import io.xnatworks.cbct.pipeline.PatientTimelineService;
import io.xnatworks.cbct.registration.CouchShift;
import io.xnatworks.cbct.registration.RegistrationExtractor;
import io.xnatworks.cbct.registration.RegistrationShiftRecord;
import io.xnatworks.cbct.report.TimelineReportWriter;
import io.xnatworks.cbct.session.AcquisitionSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.*;
import picocli.CommandLine.Model.CommandSpec;

import java.io.File;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.time.format.DateTimeFormatter;
import java.util.concurrent.Callable;

/**
 * XNAT CBCT Timeline - Main Application
 *
 * Reconstructs the treatment timeline of a cone-beam CT patient export:
 * - Discover acquisitions and classify them by preset
 * - Recover registration shifts from registration records
 * - Group acquisitions into fractions and flag the transfer-eligible ones
 */
@Command(name = "cbct-timeline",
        mixinStandardHelpOptions = true,
        version = "1.0.0",
        description = "XNAT CBCT Timeline - Reconstruct fraction timelines from CBCT exports",
        subcommands = {
                CbctTimeline.ScanCommand.class,
                CbctTimeline.ShiftsCommand.class,
                CbctTimeline.ConfigCommand.class
        })
public class CbctTimeline implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(CbctTimeline.class);

    static final int EXIT_PRECONDITION = 2;
    static final int EXIT_DATA_ERROR = 3;

    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    @Option(names = {"-c", "--config"}, description = "Config file path", defaultValue = "config.yaml")
    protected File configFile;

    @Spec
    CommandSpec spec;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new CbctTimeline()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        spec.commandLine().usage(spec.commandLine().getOut());
        return 0;
    }

    // ========================================================================
    // SCAN COMMAND - Build the timeline for one patient
    // ========================================================================

    @Command(name = "scan", description = "Reconstruct the fraction timeline of a patient export")
    static class ScanCommand implements Callable<Integer> {

        @ParentCommand
        private CbctTimeline parent;

        @Spec
        CommandSpec spec;

        @Parameters(index = "0", description = "Patient root directory")
        private Path patientRoot;

        @Option(names = {"-o", "--output"}, description = "Write the JSON report to this file")
        private Path output;

        @Option(names = {"--json"}, description = "Print the JSON report instead of the summary table")
        private boolean json;

        @Option(names = {"--threads"}, description = "Worker threads (overrides config file)")
        private Integer threads;

        @Option(names = {"--infer-undated"}, description = "Infer dates for sessions without a scan timestamp")
        private boolean inferUndated;

        @Override
        public Integer call() throws Exception {
            AppConfig config = AppConfig.load(parent.configFile);
            if (threads != null) {
                config.setWorkerThreads(Math.max(1, threads));
            }
            if (inferUndated) {
                config.setInferUndatedSessions(true);
            }
            PrintWriter out = spec.commandLine().getOut();

            PatientTimeline patient;
            try (PatientTimelineService service = new PatientTimelineService(config)) {
                patient = service.process(patientRoot);
            } catch (PreconditionException e) {
                log.error("Cannot process {}: {}", patientRoot, e.getMessage());
                spec.commandLine().getErr().println("Error: " + e.getMessage());
                return EXIT_PRECONDITION;
            }

            TimelineReportWriter writer = new TimelineReportWriter();
            if (output != null) {
                writer.write(patient, output);
            }
            if (json) {
                out.println(writer.toJson(patient));
            } else {
                printSummary(out, patient);
            }
            out.flush();
            return 0;
        }

        private static void printSummary(PrintWriter out, PatientTimeline patient) {
            out.println();
            out.println("=========================================================");
            out.println("  Patient: " + patient.getPatientRoot());
            out.println("=========================================================");
            out.println();
            out.printf("%-6s %-4s %-20s %-14s %-10s %-8s%n", "FX", "#", "TIME", "KIND", "APPLIED", "ELIGIBLE");
            out.println("---------------------------------------------------------------------");
            for (FractionGroup group : patient.getTimeline().getFractions()) {
                for (FractionEntry entry : group.getEntries()) {
                    AcquisitionSession s = entry.getSession();
                    String applied = s.hasRegistration() ? (s.getRegistration().isApplied() ? "yes" : "no") : "-";
                    out.printf("%-6s %-4d %-20s %-14s %-10s %-8s%n",
                            group.getLabel(), entry.getIntraFractionIndex(),
                            s.getEffectiveTimestamp().format(TIME_FORMAT), s.getKind().getLabel(),
                            applied, entry.isEligible() ? "yes" : "no");
                }
            }
            if (!patient.getTimeline().getExclusions().isEmpty()) {
                out.println();
                out.println("Exclusions:");
                for (Exclusion exclusion : patient.getTimeline().getExclusions()) {
                    out.printf("  %-40s %-26s %s%n", exclusion.getSession().getDirectoryName(),
                            exclusion.getReason(), exclusion.getDetail() != null ? exclusion.getDetail() : "");
                }
            }
            out.println();
            out.printf("%d session(s), %d fraction(s), %d eligible%n", patient.getSessions().size(),
                    patient.getTimeline().getFractionCount(), patient.getTimeline().getEligible().size());
        }
    }

    // ========================================================================
    // SHIFTS COMMAND - Decode a single registration record
    // ========================================================================

    @Command(name = "shifts", description = "Show the registration shifts stored in a registration record")
    static class ShiftsCommand implements Callable<Integer> {

        @ParentCommand
        private CbctTimeline parent;

        @Spec
        CommandSpec spec;

        @Parameters(index = "0", description = "Registration record (*.RPS.dcm)")
        private Path registrationFile;

        @Override
        public Integer call() throws Exception {
            AppConfig config = AppConfig.load(parent.configFile);
            PrintWriter out = spec.commandLine().getOut();

            RegistrationShiftRecord record;
            try {
                record = new RegistrationExtractor(config.getRegistration()).extract(registrationFile);
            } catch (CbctDataException e) {
                log.error("Cannot decode {}: {}", registrationFile, e.getMessage());
                spec.commandLine().getErr().println("Error: " + e.getMessage());
                return EXIT_DATA_ERROR;
            }

            out.println("Registration: " + registrationFile.getFileName());
            if (record.getAlignmentTime() != null) {
                out.println("Aligned at:   " + record.getAlignmentTime().format(TIME_FORMAT));
            }
            if (record.getRegistrationProtocol() != null) {
                out.println("Protocol:     " + record.getRegistrationProtocol());
            }
            out.println();
            out.printf("  %-14s %10.3f cm%n", "Lateral", record.getLateral());
            out.printf("  %-14s %10.3f cm%n", "Longitudinal", record.getLongitudinal());
            out.printf("  %-14s %10.3f cm%n", "Vertical", record.getVertical());
            out.printf("  %-14s %10.2f deg%n", "Coronal", record.getCoronal());
            out.printf("  %-14s %10.2f deg%n", "Sagittal", record.getSagittal());
            out.printf("  %-14s %10.2f deg%n", "Transverse", record.getTransverse());
            out.println();
            CouchShift couch = record.getCouchShift();
            out.printf("  Couch shift: lat %.3f, long %.3f, vert %.3f cm; rotations %s%n",
                    couch.getLateral(), couch.getLongitudinal(), couch.getVertical(),
                    couch.isRotationAvailable() ? "available" : "unavailable");
            out.println("  Applied:     " + (record.isApplied() ? "yes" : "no"));
            out.flush();
            return 0;
        }
    }

    // ========================================================================
    // CONFIG COMMAND - Write a starter configuration
    // ========================================================================

    @Command(name = "config", description = "Write a configuration file with the default settings")
    static class ConfigCommand implements Callable<Integer> {

        @Spec
        CommandSpec spec;

        @Option(names = {"-o", "--output"}, description = "Output file", defaultValue = "config.yaml")
        private File output;

        @Option(names = {"--force"}, description = "Overwrite an existing file")
        private boolean force;

        @Override
        public Integer call() throws Exception {
            if (output.exists() && !force) {
                spec.commandLine().getErr().println("Error: " + output + " already exists (use --force to overwrite)");
                return 1;
            }
            AppConfig.withDefaults().save(output);
            spec.commandLine().getOut().println("Wrote " + output.getAbsolutePath());
            spec.commandLine().getOut().flush();
            return 0;
        }
    }
}
