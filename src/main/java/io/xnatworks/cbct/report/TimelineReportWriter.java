/*
 * XNAT CBCT Timeline
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.cbct.report;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.xnatworks.cbct.fraction.Exclusion;
import io.xnatworks.cbct.fraction.FractionEntry;
import io.xnatworks.cbct.fraction.FractionGroup;
import io.xnatworks.cbct.pipeline.PatientTimeline;
import io.xnatworks.cbct.session.AcquisitionSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;

/**
 * Renders a {@link PatientTimeline} as a JSON {@link TimelineReport}.
 */
public class TimelineReportWriter {
    private static final Logger log = LoggerFactory.getLogger(TimelineReportWriter.class);

    private final ObjectMapper objectMapper;

    public TimelineReportWriter() {
        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    public TimelineReport toReport(PatientTimeline patient) {
        TimelineReport report = new TimelineReport();
        report.setPatientRoot(patient.getPatientRoot().toString());
        report.setGeneratedAt(LocalDateTime.now());
        report.setSessionCount(patient.getSessions().size());
        report.setFractionCount(patient.getTimeline().getFractionCount());

        for (AcquisitionSession session : patient.getSessions()) {
            report.getSessions().add(sessionRow(session));
        }

        for (FractionGroup group : patient.getTimeline().getFractions()) {
            TimelineReport.FractionRow row = new TimelineReport.FractionRow();
            row.setIndex(group.getIndex());
            row.setLabel(group.getLabel());
            row.setDate(group.getDate());
            for (FractionEntry entry : group.getEntries()) {
                TimelineReport.EntryRow e = new TimelineReport.EntryRow();
                e.setScanId(entry.getSession().getScanId());
                e.setDirectory(entry.getSession().getDirectoryName());
                e.setKind(entry.getSession().getKind().getLabel());
                e.setIntraFractionIndex(entry.getIntraFractionIndex());
                e.setEligible(entry.isEligible());
                row.getEntries().add(e);
                if (entry.isEligible()) {
                    report.getEligibleScanIds().add(entry.getSession().getScanId());
                }
            }
            report.getFractions().add(row);
        }

        for (Exclusion exclusion : patient.getTimeline().getExclusions()) {
            TimelineReport.ExclusionRow row = new TimelineReport.ExclusionRow();
            row.setScanId(exclusion.getSessionId());
            row.setDirectory(exclusion.getSession().getDirectoryName());
            row.setReason(exclusion.getReason().name());
            row.setDetail(exclusion.getDetail());
            report.getExclusions().add(row);
        }
        return report;
    }

    private static TimelineReport.SessionRow sessionRow(AcquisitionSession session) {
        TimelineReport.SessionRow row = new TimelineReport.SessionRow();
        row.setDirectory(session.getDirectoryName());
        row.setScanId(session.getScanId());
        row.setKind(session.getKind().getLabel());
        row.setScanTimestamp(session.getScanTimestamp());
        row.setInferredTimestamp(session.getInferredTimestamp());
        row.setTreatmentId(session.getTreatmentId());
        row.setAcquisitionPreset(session.getAcquisitionPreset());
        row.setTubeKv(session.getTubeKv());
        row.setTubeMa(session.getTubeMa());
        row.setHasRegistration(session.hasRegistration());
        if (session.getRegistrationFile() != null) {
            row.setRegistrationFile(session.getRegistrationFile().getFileName().toString());
        }
        row.setRegistration(session.getRegistration());
        row.setRegistrationError(session.getRegistrationError());
        row.setDegradation(session.getDegradation());
        if (!session.getWarnings().isEmpty()) {
            row.setWarnings(session.getWarnings());
        }
        return row;
    }

    public String toJson(PatientTimeline patient) throws JsonProcessingException {
        return objectMapper.writeValueAsString(toReport(patient));
    }

    public void write(PatientTimeline patient, Path output) throws IOException {
        Path parent = output.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        objectMapper.writeValue(output.toFile(), toReport(patient));
        log.info("Wrote timeline report to {}", output);
    }

    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }
}
