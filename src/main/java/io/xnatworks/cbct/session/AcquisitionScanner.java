/*
 * XNAT CBCT Timeline
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.cbct.session;

import io.xnatworks.cbct.config.AppConfig;
import io.xnatworks.cbct.error.ArtifactNotFoundException;
import io.xnatworks.cbct.error.MalformedConfigException;
import io.xnatworks.cbct.error.PreconditionException;
import io.xnatworks.cbct.registration.KeyValueConfig;
import io.xnatworks.cbct.registration.KeyValueConfigParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Discovers acquisitions under a patient root and reads their metadata.
 *
 * Expected layout:
 * <pre>
 * patient/
 *   IMAGES/
 *     img_&lt;uid&gt;/
 *       _Frames.xml
 *       Reconstruction/
 *         *.INI          (ScanUID, TubeKV, TubeMA)
 *         *.RPS.dcm      (registration record, optional)
 * </pre>
 */
public class AcquisitionScanner {
    private static final Logger log = LoggerFactory.getLogger(AcquisitionScanner.class);

    static final String SCAN_UID_KEY = "ScanUID";
    static final String TREATMENT_ID_KEY = "TreatmentID";
    static final String TUBE_KV_KEY = "TubeKV";
    static final String TUBE_MA_KEY = "TubeMA";

    private static final String INI_EXTENSION = ".INI";
    private static final String REGISTRATION_SUFFIX = ".RPS.DCM";
    private static final String DICOM_EXTENSION = ".DCM";

    private final AppConfig config;
    private final Pattern acquisitionDirPattern;
    private final FramesMetadataParser framesParser;
    private final KeyValueConfigParser iniParser;

    public AcquisitionScanner(AppConfig config) {
        this.config = config;
        this.acquisitionDirPattern = Pattern.compile(config.getAcquisitionDirPattern());
        this.framesParser = new FramesMetadataParser();
        this.iniParser = new KeyValueConfigParser();
    }

    /**
     * Acquisition directories under {@code patientRoot}, sorted by name.
     *
     * @throws PreconditionException if the patient root or its acquisition root is missing
     */
    public List<Path> listAcquisitionDirectories(Path patientRoot) throws PreconditionException {
        if (patientRoot == null || !Files.isDirectory(patientRoot)) {
            throw new PreconditionException("Patient root is not a directory: " + patientRoot);
        }
        Path acquisitionRoot = acquisitionRoot(patientRoot);
        if (!Files.isDirectory(acquisitionRoot)) {
            throw new PreconditionException("Acquisition root not found: " + acquisitionRoot);
        }

        try (Stream<Path> children = Files.list(acquisitionRoot)) {
            List<Path> dirs = children
                    .filter(Files::isDirectory)
                    .filter(p -> acquisitionDirPattern.matcher(p.getFileName().toString()).matches())
                    .sorted((a, b) -> a.getFileName().toString().compareTo(b.getFileName().toString()))
                    .collect(Collectors.toList());
            log.info("Found {} acquisition director{} under {}", dirs.size(), dirs.size() == 1 ? "y" : "ies",
                    acquisitionRoot);
            return dirs;
        } catch (IOException e) {
            throw new PreconditionException("Cannot list acquisition root " + acquisitionRoot + ": " + e.getMessage());
        }
    }

    Path acquisitionRoot(Path patientRoot) {
        String subdir = config.getImagesSubdir();
        return subdir == null || subdir.isBlank() ? patientRoot : patientRoot.resolve(subdir);
    }

    /**
     * Read one acquisition directory. Problems with individual files degrade the
     * session instead of failing.
     */
    public AcquisitionSession.Builder readAcquisition(Path dir) {
        String name = dir.getFileName().toString();
        AcquisitionSession.Builder builder = AcquisitionSession.builder(dir);

        FramesMetadata frames = null;
        try {
            frames = framesParser.parse(dir.resolve(config.getFramesFile()));
            log.debug("[{}] {}", name, frames);
        } catch (ArtifactNotFoundException e) {
            log.warn("[{}] {}", name, e.getMessage());
            builder.degradation("missing " + config.getFramesFile());
        } catch (MalformedConfigException e) {
            log.warn("[{}] {}", name, e.getMessage());
            builder.degradation("unreadable " + config.getFramesFile() + ": " + e.getMessage());
        }

        KeyValueConfig ini = readScanConfiguration(dir, builder);

        String scanUid = ini != null ? ini.get(SCAN_UID_KEY) : null;
        if (scanUid != null && !scanUid.isBlank()) {
            builder.scanId(scanUid.trim());
            builder.scanTimestamp(ScanUidParser.parse(scanUid));
        } else if (frames != null && frames.getDicomUid() != null) {
            log.debug("[{}] No ScanUID, using frame DicomUID as scan id", name);
            builder.scanId(frames.getDicomUid());
        } else {
            builder.scanId(name);
        }

        String treatmentId = frames != null ? frames.getTreatmentId() : null;
        if (treatmentId == null && ini != null) {
            treatmentId = blankToNull(ini.get(TREATMENT_ID_KEY));
        }
        builder.treatmentId(treatmentId);
        builder.acquisitionPreset(frames != null ? frames.getAcquisitionPreset() : null);

        Double kv = frames != null ? frames.getTubeKv() : null;
        Double ma = frames != null ? frames.getTubeMa() : null;
        if (ini != null) {
            if (kv == null) {
                kv = iniNumber(ini, TUBE_KV_KEY, name);
            }
            if (ma == null) {
                ma = iniNumber(ini, TUBE_MA_KEY, name);
            }
        }
        builder.tubeKv(kv).tubeMa(ma);

        builder.registrationFile(findRegistrationFile(dir));
        return builder;
    }

    private KeyValueConfig readScanConfiguration(Path dir, AcquisitionSession.Builder builder) {
        Path ini = findFirst(reconstructionDir(dir), INI_EXTENSION);
        if (ini == null) {
            ini = findFirst(dir, INI_EXTENSION);
        }
        if (ini == null) {
            log.debug("[{}] No scan configuration file", dir.getFileName());
            return null;
        }
        try {
            return iniParser.parse(ini);
        } catch (IOException e) {
            log.warn("[{}] Cannot read {}: {}", dir.getFileName(), ini.getFileName(), e.getMessage());
            builder.degradation("unreadable " + ini.getFileName());
            return null;
        }
    }

    /**
     * Registration record for the acquisition: a {@code *.RPS.dcm} if present, else any {@code *.dcm}.
     */
    Path findRegistrationFile(Path dir) {
        Path recon = reconstructionDir(dir);
        Path rps = findFirst(recon, REGISTRATION_SUFFIX);
        if (rps == null) {
            rps = findFirst(dir, REGISTRATION_SUFFIX);
        }
        if (rps == null) {
            rps = findFirst(recon, DICOM_EXTENSION);
        }
        return rps;
    }

    private Path reconstructionDir(Path dir) {
        String subdir = config.getReconstructionSubdir();
        return subdir == null || subdir.isBlank() ? dir : dir.resolve(subdir);
    }

    private static Path findFirst(Path dir, String upperSuffix) {
        if (!Files.isDirectory(dir)) {
            return null;
        }
        try (Stream<Path> files = Files.list(dir)) {
            return files
                    .filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().toUpperCase(Locale.ROOT).endsWith(upperSuffix))
                    .min((a, b) -> a.getFileName().toString().compareTo(b.getFileName().toString()))
                    .orElse(null);
        } catch (IOException e) {
            log.warn("Cannot list {}: {}", dir, e.getMessage());
            return null;
        }
    }

    private static Double iniNumber(KeyValueConfig ini, String key, String name) {
        try {
            return ini.getDouble(key);
        } catch (MalformedConfigException e) {
            log.warn("[{}] {}", name, e.getMessage());
            return null;
        }
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
