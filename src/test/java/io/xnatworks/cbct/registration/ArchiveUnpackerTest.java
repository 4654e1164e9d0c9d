/*
 * XNAT CBCT Timeline
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 */
package io.xnatworks.cbct.registration;

import io.xnatworks.cbct.dicom.DicomDataset;
import io.xnatworks.cbct.dicom.DicomElementReader;
import io.xnatworks.cbct.dicom.DicomTag;
import io.xnatworks.cbct.dicom.DicomTestFiles;
import io.xnatworks.cbct.error.ArtifactNotFoundException;
import io.xnatworks.cbct.error.CorruptArchiveException;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for ArchiveUnpacker.
 */
@DisplayName("ArchiveUnpacker Tests")
class ArchiveUnpackerTest {

    private static final DicomTag FIELD = DicomTag.parse("(0021,103A)");

    @TempDir
    Path tempDir;

    private final ArchiveUnpacker unpacker = new ArchiveUnpacker();
    private final DicomElementReader reader = new DicomElementReader();

    private static Map<String, byte[]> members(String... nameAndText) {
        Map<String, byte[]> members = new LinkedHashMap<>();
        for (int i = 0; i < nameAndText.length; i += 2) {
            members.put(nameAndText[i], nameAndText[i + 1].getBytes(StandardCharsets.UTF_8));
        }
        return members;
    }

    @Nested
    @DisplayName("Unpack Tests")
    class UnpackTests {

        @Test
        @DisplayName("Should unpack members in archive order")
        void shouldUnpackMembers() throws Exception {
            byte[] archive = DicomTestFiles.zip(members(
                    "1.3.46.423632.INI.XVI", "Align.clip1=0,0,0,0,0,0\n",
                    "notes.txt", "hello"));
            DicomDataset dataset = reader.read(DicomTestFiles.registrationRecord(archive));

            Map<String, byte[]> unpacked = unpacker.unpack(dataset, FIELD);

            assertEquals(List.of("1.3.46.423632.INI.XVI", "notes.txt"), List.copyOf(unpacked.keySet()));
            assertEquals("hello", new String(unpacked.get("notes.txt"), StandardCharsets.UTF_8));
        }

        @Test
        @DisplayName("Should unpack from a record file")
        void shouldUnpackFromFile() throws Exception {
            Path file = DicomTestFiles.writeRegistrationRecord(
                    tempDir.resolve("Reconstruction/reg.RPS.dcm"), "a.INI.XVI", "Key=Value\n");

            Map<String, byte[]> unpacked = unpacker.unpack(file, FIELD);

            assertEquals(1, unpacked.size());
            assertTrue(unpacked.containsKey("a.INI.XVI"));
        }

        @Test
        @DisplayName("Should skip directory entries")
        void shouldSkipDirectories() throws Exception {
            ByteArrayOutputStream bytes = new ByteArrayOutputStream();
            try (ZipOutputStream zip = new ZipOutputStream(bytes)) {
                zip.putNextEntry(new ZipEntry("nested/"));
                zip.closeEntry();
                zip.putNextEntry(new ZipEntry("nested/reg.INI.XVI"));
                zip.write("A=1".getBytes(StandardCharsets.UTF_8));
                zip.closeEntry();
            }

            Map<String, byte[]> unpacked = unpacker.unpack(bytes.toByteArray(), FIELD);

            assertEquals(List.of("nested/reg.INI.XVI"), List.copyOf(unpacked.keySet()));
        }

        @Test
        @DisplayName("Result is not modifiable")
        void resultIsUnmodifiable() throws Exception {
            Map<String, byte[]> unpacked = unpacker.unpack(DicomTestFiles.zip(members("a.txt", "x")), FIELD);

            assertThrows(UnsupportedOperationException.class, () -> unpacked.put("b", new byte[0]));
        }
    }

    @Nested
    @DisplayName("Failure Tests")
    class FailureTests {

        @Test
        @DisplayName("Absent field is reported as not found")
        void absentFieldIsNotFound() throws Exception {
            DicomDataset dataset = reader.read(DicomTestFiles.record()
                    .string(DicomDataset.MODALITY, "CS", "REG")
                    .build());

            assertThrows(ArtifactNotFoundException.class, () -> unpacker.unpack(dataset, FIELD));
        }

        @Test
        @DisplayName("Empty field is reported as not found")
        void emptyFieldIsNotFound() throws Exception {
            DicomDataset dataset = reader.read(DicomTestFiles.registrationRecord(new byte[0]));

            assertThrows(ArtifactNotFoundException.class, () -> unpacker.unpack(dataset, FIELD));
        }

        @Test
        @DisplayName("Bytes without zip signature are corrupt")
        void nonZipIsCorrupt() throws Exception {
            DicomDataset dataset = reader.read(DicomTestFiles.registrationRecord(
                    "not a zip archive".getBytes(StandardCharsets.US_ASCII)));

            assertThrows(CorruptArchiveException.class, () -> unpacker.unpack(dataset, FIELD));
        }

        @Test
        @DisplayName("Truncated zip is corrupt")
        void truncatedZipIsCorrupt() throws Exception {
            byte[] archive = DicomTestFiles.zip(members("reg.INI.XVI", "Align.clip1=1,2,3,4,5,6\n".repeat(50)));
            byte[] truncated = Arrays.copyOf(archive, 40);

            assertThrows(CorruptArchiveException.class, () -> unpacker.unpack(truncated, FIELD));
        }

        @Test
        @DisplayName("Unreadable record file is corrupt")
        void unreadableFileIsCorrupt() throws Exception {
            Path file = tempDir.resolve("broken.RPS.dcm");
            Files.write(file, new byte[] { 1, 2, 3 });

            assertThrows(CorruptArchiveException.class, () -> unpacker.unpack(file, FIELD));
        }
    }

    @Nested
    @DisplayName("Member Lookup Tests")
    class MemberLookupTests {

        @Test
        @DisplayName("Should find member by suffix ignoring case")
        void shouldFindBySuffix() throws Exception {
            Map<String, byte[]> unpacked = members("readme.txt", "x", "1.3.46.ini.xvi", "A=1");

            Map.Entry<String, byte[]> member = ArchiveUnpacker.findMember(unpacked, ".INI.XVI");

            assertEquals("1.3.46.ini.xvi", member.getKey());
        }

        @Test
        @DisplayName("Missing member is reported as not found")
        void missingMemberIsNotFound() {
            Map<String, byte[]> unpacked = members("readme.txt", "x");

            ArtifactNotFoundException e = assertThrows(ArtifactNotFoundException.class,
                    () -> ArchiveUnpacker.findMember(unpacked, ".INI.XVI"));
            assertTrue(e.getMessage().contains("readme.txt"));
        }
    }
}
