/*
 * XNAT CBCT Timeline
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.cbct.registration;

import io.xnatworks.cbct.dicom.DicomDataset;
import io.xnatworks.cbct.dicom.DicomElementReader;
import io.xnatworks.cbct.dicom.DicomTag;
import io.xnatworks.cbct.error.ArtifactNotFoundException;
import io.xnatworks.cbct.error.CorruptArchiveException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.zip.ZipEntry;
import java.util.zip.ZipException;
import java.util.zip.ZipInputStream;

/**
 * Extracts the zip archive embedded in a private element of a registration record.
 * Everything happens in memory: the archive is never written to disk.
 */
public class ArchiveUnpacker {
    private static final Logger log = LoggerFactory.getLogger(ArchiveUnpacker.class);

    private static final byte[] LOCAL_FILE_HEADER = { 'P', 'K', 3, 4 };

    private final DicomElementReader reader;

    public ArchiveUnpacker() {
        this(new DicomElementReader());
    }

    public ArchiveUnpacker(DicomElementReader reader) {
        this.reader = reader;
    }

    /**
     * Read the record at {@code recordFile} and unpack the archive held at {@code field}.
     */
    public Map<String, byte[]> unpack(Path recordFile, DicomTag field)
            throws ArtifactNotFoundException, CorruptArchiveException {
        DicomDataset dataset;
        try {
            dataset = reader.read(recordFile);
        } catch (IOException e) {
            throw new CorruptArchiveException("Unreadable registration record " + recordFile.getFileName()
                    + ": " + e.getMessage(), e);
        }
        return unpack(dataset, field);
    }

    /**
     * Unpack the archive held at {@code field}.
     *
     * @return member name to member bytes, in archive order, directories omitted
     * @throws ArtifactNotFoundException if the field is absent or empty
     * @throws CorruptArchiveException if the bytes are not a readable zip container
     */
    public Map<String, byte[]> unpack(DicomDataset dataset, DicomTag field)
            throws ArtifactNotFoundException, CorruptArchiveException {
        byte[] data = dataset.getBytes(field);
        if (data == null || data.length == 0) {
            throw new ArtifactNotFoundException("No archive at " + field);
        }
        return unpack(data, field);
    }

    Map<String, byte[]> unpack(byte[] data, DicomTag field) throws CorruptArchiveException {
        if (!startsWithLocalFileHeader(data)) {
            throw new CorruptArchiveException("Field " + field + " does not hold a zip archive ("
                    + data.length + " bytes)");
        }

        Map<String, byte[]> members = new LinkedHashMap<>();
        try (ZipInputStream zip = new ZipInputStream(new ByteArrayInputStream(data))) {
            ZipEntry entry;
            while ((entry = zip.getNextEntry()) != null) {
                if (entry.isDirectory()) {
                    continue;
                }
                byte[] content = zip.readAllBytes();
                members.put(entry.getName(), content);
                log.debug("Unpacked {} ({} bytes) from {}", entry.getName(), content.length, field);
            }
        } catch (ZipException e) {
            throw new CorruptArchiveException("Broken zip archive at " + field + ": " + e.getMessage(), e);
        } catch (IOException e) {
            throw new CorruptArchiveException("Failed to read zip archive at " + field + ": " + e.getMessage(), e);
        }

        if (members.isEmpty()) {
            throw new CorruptArchiveException("Zip archive at " + field + " has no file members");
        }
        return Collections.unmodifiableMap(members);
    }

    /**
     * First member whose name ends with {@code suffix}, ignoring case.
     */
    public static Map.Entry<String, byte[]> findMember(Map<String, byte[]> members, String suffix)
            throws ArtifactNotFoundException {
        String wanted = suffix.toUpperCase(Locale.ROOT);
        for (Map.Entry<String, byte[]> entry : members.entrySet()) {
            if (entry.getKey().toUpperCase(Locale.ROOT).endsWith(wanted)) {
                return entry;
            }
        }
        throw new ArtifactNotFoundException("No archive member ending with " + suffix
                + " among " + members.keySet());
    }

    private static boolean startsWithLocalFileHeader(byte[] data) {
        if (data.length < LOCAL_FILE_HEADER.length) {
            return false;
        }
        for (int i = 0; i < LOCAL_FILE_HEADER.length; i++) {
            if (data[i] != LOCAL_FILE_HEADER[i]) {
                return false;
            }
        }
        return true;
    }
}
