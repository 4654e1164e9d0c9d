/*
 * XNAT CBCT Timeline
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.cbct.registration;

import io.xnatworks.cbct.config.AppConfig;
import io.xnatworks.cbct.dicom.DicomDataset;
import io.xnatworks.cbct.dicom.DicomTag;
import io.xnatworks.cbct.error.ArtifactNotFoundException;
import io.xnatworks.cbct.error.CbctDataException;
import io.xnatworks.cbct.error.MalformedConfigException;
import io.xnatworks.cbct.error.MalformedMatrixException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.DateTimeException;
import java.time.LocalDateTime;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recovers the clinical shift record from one registration record:
 * embedded archive, registration member, key=value fields, decoded vectors, reconciled record.
 *
 * Each stage takes immutable input and returns immutable output; nothing is written to disk.
 */
public class RegistrationExtractor {
    private static final Logger log = LoggerFactory.getLogger(RegistrationExtractor.class);

    static final String DATE_TIME_FIELD = "DateTime";
    static final String PROTOCOL_FIELD = "RegistrationProtocol";
    static final String COUCH_LATERAL_FIELD = "CouchShiftLat";
    static final String COUCH_LONGITUDINAL_FIELD = "CouchShiftLong";
    static final String COUCH_VERTICAL_FIELD = "CouchShiftHeight";
    static final String ALIGNMENT_SECTION_PREFIX = "ALIGNMENT.";

    private static final Pattern ALIGNMENT_TIME = Pattern.compile(
            "(\\d{4})(\\d{2})(\\d{2})\\s*;\\s*(\\d{1,2}):(\\d{2}):(\\d{2})");

    private final AppConfig.RegistrationSettings settings;
    private final DicomTag archiveTag;
    private final ArchiveUnpacker unpacker;
    private final KeyValueConfigParser parser;
    private final MatrixFieldDecoder decoder;
    private final CoordinateReconciler reconciler;

    public RegistrationExtractor() {
        this(new AppConfig.RegistrationSettings());
    }

    public RegistrationExtractor(AppConfig.RegistrationSettings settings) {
        this(settings, new ArchiveUnpacker(), new KeyValueConfigParser(),
                new MatrixFieldDecoder(), new CoordinateReconciler());
    }

    public RegistrationExtractor(AppConfig.RegistrationSettings settings, ArchiveUnpacker unpacker,
                                 KeyValueConfigParser parser, MatrixFieldDecoder decoder,
                                 CoordinateReconciler reconciler) {
        this.settings = settings;
        this.archiveTag = DicomTag.parse(settings.getTag());
        this.unpacker = unpacker;
        this.parser = parser;
        this.decoder = decoder;
        this.reconciler = reconciler;
    }

    public RegistrationShiftRecord extract(Path registrationFile) throws CbctDataException {
        log.debug("Extracting registration from {}", registrationFile);
        Map<String, byte[]> members = unpacker.unpack(registrationFile, archiveTag);
        return extractFromMembers(members);
    }

    public RegistrationShiftRecord extract(DicomDataset record) throws CbctDataException {
        Map<String, byte[]> members = unpacker.unpack(record, archiveTag);
        return extractFromMembers(members);
    }

    private RegistrationShiftRecord extractFromMembers(Map<String, byte[]> members) throws CbctDataException {
        Map.Entry<String, byte[]> member = ArchiveUnpacker.findMember(members, settings.getArchiveMemberSuffix());
        KeyValueConfig fields = parser.parse(member.getValue());
        log.debug("Registration member {} has {} fields", member.getKey(), fields.size());
        return extract(fields);
    }

    /**
     * Build the shift record from an already parsed registration member.
     */
    public RegistrationShiftRecord extract(KeyValueConfig fields) throws CbctDataException {
        AlignmentTuple alignment = decoder.decodeAlignment(fields, settings.getAlignmentField());
        RegistrationShiftRecord reconciled = reconciler.reconcile(alignment);

        return reconciled.toBuilder()
                .unmatchedTransform(optionalTransform(fields, settings.getUnmatchedMatrixField()))
                .correctionTransform(optionalTransform(fields, settings.getCorrectionMatrixField()))
                .maskAlignment(optionalMask(fields))
                .recordedCouchShift(recordedCouchShift(fields))
                .registrationProtocol(fields.get(PROTOCOL_FIELD))
                .alignmentTime(alignmentTime(fields))
                .build();
    }

    private Transform4x4 optionalTransform(KeyValueConfig fields, String field) throws MalformedMatrixException {
        if (!fields.contains(field)) {
            log.debug("Registration member has no {} field", field);
            return null;
        }
        try {
            return decoder.decodeTransform(fields, field);
        } catch (ArtifactNotFoundException e) {
            // Present but blank
            return null;
        }
    }

    private AlignmentTuple optionalMask(KeyValueConfig fields) {
        String field = settings.getMaskField();
        if (field == null || !fields.contains(field)) {
            return null;
        }
        try {
            return decoder.decodeAlignment(fields, field);
        } catch (ArtifactNotFoundException | MalformedMatrixException e) {
            log.warn("Ignoring mask alignment: {}", e.getMessage());
            return null;
        }
    }

    private static CouchShift recordedCouchShift(KeyValueConfig fields) {
        try {
            Double lat = fields.getDouble(COUCH_LATERAL_FIELD);
            Double lng = fields.getDouble(COUCH_LONGITUDINAL_FIELD);
            Double vert = fields.getDouble(COUCH_VERTICAL_FIELD);
            if (lat == null && lng == null && vert == null) {
                return null;
            }
            return new CouchShift(lat, lng, vert);
        } catch (MalformedConfigException e) {
            log.warn("Ignoring recorded couch shift: {}", e.getMessage());
            return null;
        }
    }

    /**
     * Alignment time from the {@code DateTime} field, else from an {@code [ALIGNMENT.<date>; <time>]} header.
     */
    static LocalDateTime alignmentTime(KeyValueConfig fields) {
        LocalDateTime time = parseAlignmentTime(fields.get(DATE_TIME_FIELD));
        if (time != null) {
            return time;
        }
        for (String section : fields.getSections()) {
            if (section.toUpperCase(Locale.ROOT).startsWith(ALIGNMENT_SECTION_PREFIX)) {
                time = parseAlignmentTime(section.substring(ALIGNMENT_SECTION_PREFIX.length()));
                if (time != null) {
                    return time;
                }
            }
        }
        return null;
    }

    static LocalDateTime parseAlignmentTime(String raw) {
        if (raw == null) {
            return null;
        }
        Matcher m = ALIGNMENT_TIME.matcher(raw);
        if (!m.find()) {
            return null;
        }
        try {
            return LocalDateTime.of(
                    Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2)), Integer.parseInt(m.group(3)),
                    Integer.parseInt(m.group(4)), Integer.parseInt(m.group(5)), Integer.parseInt(m.group(6)));
        } catch (DateTimeException e) {
            log.warn("Invalid alignment time '{}': {}", raw, e.getMessage());
            return null;
        }
    }
}
