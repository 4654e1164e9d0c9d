/*
 * XNAT CBCT Timeline
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.cbct.pipeline;

import io.xnatworks.cbct.config.AppConfig;
import io.xnatworks.cbct.error.CbctDataException;
import io.xnatworks.cbct.error.PreconditionException;
import io.xnatworks.cbct.fraction.FractionAssigner;
import io.xnatworks.cbct.fraction.FractionTimeline;
import io.xnatworks.cbct.registration.RegistrationExtractor;
import io.xnatworks.cbct.registration.RegistrationShiftRecord;
import io.xnatworks.cbct.session.AcquisitionScanner;
import io.xnatworks.cbct.session.AcquisitionSession;
import io.xnatworks.cbct.session.SessionClassifier;
import io.xnatworks.cbct.session.UndatedSessionMatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * Reconstructs the treatment timeline of one patient.
 *
 * Acquisitions are scanned and their registrations extracted in parallel on a bounded
 * pool. Fraction assignment starts only once every acquisition task has finished.
 * Problems with a single acquisition are recorded on its session; only a missing
 * patient or acquisition root aborts the run.
 */
public class PatientTimelineService implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(PatientTimelineService.class);

    private final AppConfig config;
    private final AcquisitionScanner scanner;
    private final RegistrationExtractor extractor;
    private final SessionClassifier classifier;
    private final UndatedSessionMatcher undatedMatcher;
    private final FractionAssigner assigner;
    private final ExecutorService executor;

    public PatientTimelineService(AppConfig config) {
        this(config, new AcquisitionScanner(config), new RegistrationExtractor(config.getRegistration()),
                SessionClassifier.fromConfig(config), new UndatedSessionMatcher(), new FractionAssigner());
    }

    public PatientTimelineService(AppConfig config, AcquisitionScanner scanner, RegistrationExtractor extractor,
                                  SessionClassifier classifier, UndatedSessionMatcher undatedMatcher,
                                  FractionAssigner assigner) {
        this.config = config;
        this.scanner = scanner;
        this.extractor = extractor;
        this.classifier = classifier;
        this.undatedMatcher = undatedMatcher;
        this.assigner = assigner;

        int threads = Math.max(1, config.getWorkerThreads());
        this.executor = Executors.newFixedThreadPool(threads, r -> {
            Thread t = new Thread(r, "acquisition-worker");
            t.setDaemon(true);
            return t;
        });
        log.debug("Acquisition worker pool started with {} thread(s)", threads);
    }

    /**
     * Process one patient export tree.
     *
     * @throws PreconditionException if the patient root or its acquisition root is missing
     * @throws InterruptedException if interrupted while waiting for acquisition tasks
     */
    public PatientTimeline process(Path patientRoot) throws PreconditionException, InterruptedException {
        log.info("Processing patient root {}", patientRoot);
        List<Path> directories = scanner.listAcquisitionDirectories(patientRoot);

        List<Future<AcquisitionSession>> futures = new ArrayList<>();
        for (Path dir : directories) {
            futures.add(executor.submit(() -> processAcquisition(dir)));
        }

        List<AcquisitionSession> sessions = new ArrayList<>();
        try {
            for (Future<AcquisitionSession> future : futures) {
                sessions.add(future.get());
            }
        } catch (InterruptedException e) {
            int pending = 0;
            for (Future<AcquisitionSession> future : futures) {
                if (future.cancel(true)) {
                    pending++;
                }
            }
            log.warn("Interrupted while processing {}; cancelled {} unfinished task(s)", patientRoot, pending);
            throw e;
        } catch (ExecutionException e) {
            throw new IllegalStateException("Acquisition task failed unexpectedly", e.getCause());
        }
        log.info("Discovered {} session(s) under {}", sessions.size(), patientRoot);

        if (config.isInferUndatedSessions()) {
            int inferred = undatedMatcher.match(sessions);
            if (inferred > 0) {
                log.info("Inferred scan dates for {} undated session(s)", inferred);
            }
        }

        FractionTimeline timeline = assigner.assign(sessions);
        return new PatientTimeline(patientRoot, sessions, timeline);
    }

    /**
     * Scan, extract and classify one acquisition. Never throws: failures become degradations.
     */
    AcquisitionSession processAcquisition(Path dir) {
        String name = dir.getFileName().toString();
        AcquisitionSession.Builder builder;
        try {
            builder = scanner.readAcquisition(dir);
        } catch (RuntimeException e) {
            log.error("[{}] Unexpected error reading acquisition: {}", name, e.getMessage(), e);
            builder = AcquisitionSession.builder(dir).degradation("unreadable acquisition: " + e.getMessage());
        }

        Path registrationFile = builder.getRegistrationFile();
        if (registrationFile != null) {
            try {
                RegistrationShiftRecord record = extractor.extract(registrationFile);
                builder.registration(record);
                log.debug("[{}] {}", name, record);
            } catch (CbctDataException e) {
                log.warn("[{}] Registration {} unusable: {}", name, registrationFile.getFileName(), e.getMessage());
                builder.registrationError(e.getMessage());
            } catch (RuntimeException e) {
                log.error("[{}] Unexpected error extracting registration: {}", name, e.getMessage(), e);
                builder.registrationError(e.toString());
            }
        } else {
            log.debug("[{}] No registration record", name);
        }

        AcquisitionSession session = builder.build();
        classifier.classify(session);
        return session;
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(30, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
