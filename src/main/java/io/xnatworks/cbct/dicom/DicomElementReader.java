/*
 * XNAT CBCT Timeline
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.cbct.dicom;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedInputStream;
import java.io.ByteArrayInputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.PushbackInputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.zip.Inflater;
import java.util.zip.InflaterInputStream;

/**
 * Reader for DICOM Part 10 records.
 *
 * Only what registration extraction needs is supported:
 * - file meta information (explicit VR little endian)
 * - implicit VR LE, explicit VR LE, deflated explicit VR LE and explicit VR BE datasets
 * - top-level elements are materialised, sequences and undefined-length values are skipped
 *
 * Files without the 128-byte preamble are read as a bare dataset, with the VR
 * encoding sniffed from the first element.
 */
public class DicomElementReader {
    private static final Logger log = LoggerFactory.getLogger(DicomElementReader.class);

    public static final String IMPLICIT_VR_LITTLE_ENDIAN = "1.2.840.10008.1.2";
    public static final String EXPLICIT_VR_LITTLE_ENDIAN = "1.2.840.10008.1.2.1";
    public static final String DEFLATED_EXPLICIT_VR_LITTLE_ENDIAN = "1.2.840.10008.1.2.1.99";
    public static final String EXPLICIT_VR_BIG_ENDIAN = "1.2.840.10008.1.2.2";

    static final int TRANSFER_SYNTAX_UID = 0x00020010;
    static final int PIXEL_DATA = 0x7FE00010;
    static final int ITEM = 0xFFFEE000;
    static final int ITEM_DELIMITATION = 0xFFFEE00D;
    static final int SEQUENCE_DELIMITATION = 0xFFFEE0DD;

    private static final long UNDEFINED_LENGTH = 0xFFFFFFFFL;
    private static final int PREAMBLE_LENGTH = 128;
    private static final int MAX_VALUE_LENGTH = Integer.MAX_VALUE - 8;

    // VRs with a 2-byte reserved field and 4-byte length in explicit encodings
    private static final Set<String> LONG_LENGTH_VRS = Set.of(
            "OB", "OD", "OF", "OL", "OV", "OW", "SQ", "SV", "UC", "UN", "UR", "UT", "UV");

    private final boolean stopAtPixelData;

    public DicomElementReader() {
        this(true);
    }

    public DicomElementReader(boolean stopAtPixelData) {
        this.stopAtPixelData = stopAtPixelData;
    }

    public DicomDataset read(Path file) throws IOException {
        try (InputStream in = new BufferedInputStream(Files.newInputStream(file))) {
            return read(in);
        } catch (IOException e) {
            throw new IOException("Failed to read DICOM record " + file + ": " + e.getMessage(), e);
        }
    }

    public DicomDataset read(byte[] data) throws IOException {
        return read(new ByteArrayInputStream(data));
    }

    public DicomDataset read(InputStream input) throws IOException {
        PushbackInputStream in = new PushbackInputStream(input, PREAMBLE_LENGTH + 4);
        byte[] head = in.readNBytes(PREAMBLE_LENGTH + 4);

        Map<Integer, DicomElement> elements = new LinkedHashMap<>();
        String transferSyntax;

        if (head.length == PREAMBLE_LENGTH + 4 && isDicmMagic(head)) {
            Cursor meta = new Cursor(in, false, true);
            readFileMetaInformation(meta, in, elements);
            transferSyntax = textValue(elements.get(TRANSFER_SYNTAX_UID));
            if (transferSyntax == null) {
                log.debug("No transfer syntax in file meta information, assuming explicit VR little endian");
                transferSyntax = EXPLICIT_VR_LITTLE_ENDIAN;
            }
        } else {
            in.unread(head);
            transferSyntax = sniffBareDataset(in);
        }

        Cursor dataset = cursorFor(transferSyntax, in);
        readDataset(dataset, elements);
        return new DicomDataset(transferSyntax, elements);
    }

    private static boolean isDicmMagic(byte[] head) {
        return head[PREAMBLE_LENGTH] == 'D' && head[PREAMBLE_LENGTH + 1] == 'I'
                && head[PREAMBLE_LENGTH + 2] == 'C' && head[PREAMBLE_LENGTH + 3] == 'M';
    }

    private void readFileMetaInformation(Cursor cursor, PushbackInputStream in,
                                         Map<Integer, DicomElement> elements) throws IOException {
        while (true) {
            byte[] groupBytes = in.readNBytes(2);
            if (groupBytes.length < 2) {
                in.unread(groupBytes);
                return;
            }
            int group = (groupBytes[0] & 0xFF) | ((groupBytes[1] & 0xFF) << 8);
            if (group != 0x0002) {
                in.unread(groupBytes);
                return;
            }
            int element = cursor.readUnsignedShort();
            readElement(cursor, (group << 16) | element, elements);
        }
    }

    private static String sniffBareDataset(PushbackInputStream in) throws IOException {
        byte[] probe = in.readNBytes(6);
        in.unread(probe);
        if (probe.length == 6 && Character.isUpperCase(probe[4]) && Character.isUpperCase(probe[5])) {
            return EXPLICIT_VR_LITTLE_ENDIAN;
        }
        return IMPLICIT_VR_LITTLE_ENDIAN;
    }

    private static Cursor cursorFor(String transferSyntax, InputStream in) {
        switch (transferSyntax) {
            case IMPLICIT_VR_LITTLE_ENDIAN:
                return new Cursor(in, false, false);
            case EXPLICIT_VR_BIG_ENDIAN:
                return new Cursor(in, true, true);
            case DEFLATED_EXPLICIT_VR_LITTLE_ENDIAN:
                return new Cursor(new InflaterInputStream(in, new Inflater(true)), false, true);
            default:
                // Encapsulated (compressed pixel) syntaxes all use explicit VR LE for the dataset
                return new Cursor(in, false, true);
        }
    }

    private void readDataset(Cursor cursor, Map<Integer, DicomElement> elements) throws IOException {
        while (true) {
            int group = cursor.readUnsignedShortOrEof();
            if (group < 0) {
                return;
            }
            int tag = (group << 16) | cursor.readUnsignedShort();
            if (tag == PIXEL_DATA && stopAtPixelData) {
                return;
            }
            if (tag == ITEM || tag == ITEM_DELIMITATION || tag == SEQUENCE_DELIMITATION) {
                throw new IOException("Unexpected delimiter " + DicomTag.valueOf(tag) + " at top level");
            }
            readElement(cursor, tag, elements);
        }
    }

    private void readElement(Cursor cursor, int tag, Map<Integer, DicomElement> elements) throws IOException {
        String vr = null;
        long length;
        if (cursor.explicitVr) {
            vr = cursor.readVr(tag);
            if (LONG_LENGTH_VRS.contains(vr)) {
                cursor.skip(2);
                length = cursor.readUnsignedInt();
            } else {
                length = cursor.readUnsignedShort();
            }
        } else {
            length = cursor.readUnsignedInt();
        }

        if (length == UNDEFINED_LENGTH) {
            skipUndefinedLength(cursor);
            elements.put(tag, new DicomElement(tag, vr, null));
            return;
        }
        if (length > MAX_VALUE_LENGTH) {
            throw new IOException("Element " + DicomTag.valueOf(tag) + " length " + length + " is not supported");
        }
        if ("SQ".equals(vr)) {
            cursor.skip(length);
            elements.put(tag, new DicomElement(tag, vr, null));
            return;
        }
        elements.put(tag, new DicomElement(tag, vr, cursor.readBytes((int) length)));
    }

    /**
     * Skip the items of an undefined-length sequence or encapsulated value up to its delimiter.
     */
    private void skipUndefinedLength(Cursor cursor) throws IOException {
        while (true) {
            int tag = cursor.readTag();
            long length = cursor.readUnsignedInt();
            if (tag == SEQUENCE_DELIMITATION) {
                return;
            }
            if (tag != ITEM) {
                throw new IOException("Expected item tag, found " + DicomTag.valueOf(tag));
            }
            if (length == UNDEFINED_LENGTH) {
                skipItemDataset(cursor);
            } else {
                cursor.skip(length);
            }
        }
    }

    private void skipItemDataset(Cursor cursor) throws IOException {
        while (true) {
            int tag = cursor.readTag();
            if (tag == ITEM_DELIMITATION) {
                cursor.readUnsignedInt();
                return;
            }
            long length;
            if (cursor.explicitVr) {
                String vr = cursor.readVr(tag);
                if (LONG_LENGTH_VRS.contains(vr)) {
                    cursor.skip(2);
                    length = cursor.readUnsignedInt();
                } else {
                    length = cursor.readUnsignedShort();
                }
            } else {
                length = cursor.readUnsignedInt();
            }
            if (length == UNDEFINED_LENGTH) {
                skipUndefinedLength(cursor);
            } else {
                cursor.skip(length);
            }
        }
    }

    private static String textValue(DicomElement element) {
        if (element == null || !element.hasValue()) {
            return null;
        }
        String text = new String(element.getValue(), StandardCharsets.US_ASCII);
        return text.replace("\0", "").trim();
    }

    /**
     * Byte-order aware reader over the underlying stream.
     */
    private static final class Cursor {
        private final InputStream in;
        private final boolean bigEndian;
        private final boolean explicitVr;

        Cursor(InputStream in, boolean bigEndian, boolean explicitVr) {
            this.in = in;
            this.bigEndian = bigEndian;
            this.explicitVr = explicitVr;
        }

        int readUnsignedShortOrEof() throws IOException {
            int b0 = in.read();
            if (b0 < 0) {
                return -1;
            }
            int b1 = in.read();
            if (b1 < 0) {
                throw new EOFException("Truncated element tag");
            }
            return bigEndian ? (b0 << 8) | b1 : b0 | (b1 << 8);
        }

        int readUnsignedShort() throws IOException {
            byte[] b = readBytes(2);
            return bigEndian
                    ? ((b[0] & 0xFF) << 8) | (b[1] & 0xFF)
                    : (b[0] & 0xFF) | ((b[1] & 0xFF) << 8);
        }

        long readUnsignedInt() throws IOException {
            byte[] b = readBytes(4);
            long value;
            if (bigEndian) {
                value = ((long) (b[0] & 0xFF) << 24) | ((b[1] & 0xFF) << 16) | ((b[2] & 0xFF) << 8) | (b[3] & 0xFF);
            } else {
                value = ((long) (b[3] & 0xFF) << 24) | ((b[2] & 0xFF) << 16) | ((b[1] & 0xFF) << 8) | (b[0] & 0xFF);
            }
            return value;
        }

        int readTag() throws IOException {
            int group = readUnsignedShort();
            return (group << 16) | readUnsignedShort();
        }

        String readVr(int tag) throws IOException {
            byte[] b = readBytes(2);
            if (!Character.isUpperCase(b[0]) || !Character.isUpperCase(b[1])) {
                throw new IOException("Invalid VR for element " + DicomTag.valueOf(tag));
            }
            return new String(b, StandardCharsets.US_ASCII);
        }

        byte[] readBytes(int length) throws IOException {
            byte[] data = in.readNBytes(length);
            if (data.length < length) {
                throw new EOFException("Truncated value: expected " + length + " bytes, got " + data.length);
            }
            return data;
        }

        void skip(long length) throws IOException {
            long remaining = length;
            while (remaining > 0) {
                long skipped = in.skip(remaining);
                if (skipped <= 0) {
                    if (in.read() < 0) {
                        throw new EOFException("Truncated value while skipping " + length + " bytes");
                    }
                    skipped = 1;
                }
                remaining -= skipped;
            }
        }
    }
}
