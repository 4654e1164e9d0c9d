/*
 * XNAT CBCT Timeline
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 */
package io.xnatworks.cbct.registration;

import io.xnatworks.cbct.error.MalformedConfigException;
import org.junit.jupiter.api.*;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for KeyValueConfigParser.
 */
@DisplayName("KeyValueConfigParser Tests")
class KeyValueConfigParserTest {

    private static final String SCAN_INI = String.join("\n",
            "[XVI]",
            "SomeUnrelatedKey=ignored",
            "",
            "[IDENTIFICATION]",
            "PatientID=15002197",
            "TreatmentID=WholeBrain-C2Retrt",
            "",
            "[RECONSTRUCTION]",
            "ScanUID=1.3.46.423632.33783920233217242713.224.2023-03-21165402768",
            "TubeKV=100.0000",
            "TubeMA=10.0000",
            "CollimatorName=S20");

    private final KeyValueConfigParser parser = new KeyValueConfigParser();

    @Nested
    @DisplayName("Parsing Tests")
    class ParsingTests {

        @Test
        @DisplayName("Should parse keys across sections")
        void shouldParseKeysAcrossSections() {
            KeyValueConfig config = parser.parse(SCAN_INI);

            assertEquals("WholeBrain-C2Retrt", config.get("TreatmentID"));
            assertEquals("1.3.46.423632.33783920233217242713.224.2023-03-21165402768", config.get("ScanUID"));
            assertEquals("S20", config.get("CollimatorName"));
            assertEquals(List.of("XVI", "IDENTIFICATION", "RECONSTRUCTION"), config.getSections());
            assertEquals(0, config.getMalformedLineCount());
        }

        @Test
        @DisplayName("Should trim keys and values and split on first equals sign")
        void shouldSplitOnFirstEquals() {
            KeyValueConfig config = parser.parse("  Expr =  a=b=c  \n");

            assertEquals("a=b=c", config.get("Expr"));
        }

        @Test
        @DisplayName("Should skip comment lines")
        void shouldSkipComments() {
            KeyValueConfig config = parser.parse("; comment\n# other=comment\nKey=Value\n");

            assertEquals(1, config.size());
            assertEquals("Value", config.get("Key"));
            assertFalse(config.contains("# other"));
        }

        @Test
        @DisplayName("Should handle Windows line endings")
        void shouldHandleCrLf() {
            KeyValueConfig config = parser.parse("A=1\r\nB=2\r\n");

            assertEquals("1", config.get("A"));
            assertEquals("2", config.get("B"));
        }

        @Test
        @DisplayName("Should keep empty values")
        void shouldKeepEmptyValues() {
            KeyValueConfig config = parser.parse("Empty=\n");

            assertTrue(config.contains("Empty"));
            assertEquals("", config.get("Empty"));
        }

        @Test
        @DisplayName("Should decode bytes as UTF-8 and replace malformed input")
        void shouldDecodeBytes() {
            byte[] data = "Name=Café\nBad=".getBytes(StandardCharsets.UTF_8);
            byte[] withInvalid = new byte[data.length + 1];
            System.arraycopy(data, 0, withInvalid, 0, data.length);
            withInvalid[data.length] = (byte) 0xFF;

            KeyValueConfig config = parser.parse(withInvalid);

            assertEquals("Café", config.get("Name"));
            assertEquals("\uFFFD", config.get("Bad"));
        }

        @Test
        @DisplayName("Should return empty config for null text")
        void shouldHandleNull() {
            KeyValueConfig config = parser.parse((String) null);

            assertEquals(0, config.size());
        }
    }

    @Nested
    @DisplayName("Malformed Input Tests")
    class MalformedInputTests {

        @Test
        @DisplayName("Should skip and count lines without equals sign or key")
        void shouldCountMalformedLines() {
            KeyValueConfig config = parser.parse("Good=1\nno separator here\n=orphan value\nAlso=2\n");

            assertEquals(2, config.getMalformedLineCount());
            assertEquals("1", config.get("Good"));
            assertEquals("2", config.get("Also"));
            assertEquals(2, config.size());
        }

        @Test
        @DisplayName("Last duplicate wins, all occurrences kept")
        void lastDuplicateWins() {
            KeyValueConfig config = parser.parse("Align.clip1=1,2,3,4,5,6\n[ALIGNMENT.2]\nAlign.clip1=6,5,4,3,2,1\n");

            assertEquals("6,5,4,3,2,1", config.get("Align.clip1"));
            assertEquals(List.of("1,2,3,4,5,6", "6,5,4,3,2,1"), config.getAll("Align.clip1"));
            assertTrue(config.getAll("Missing").isEmpty());
        }
    }

    @Nested
    @DisplayName("Numeric Value Tests")
    class NumericValueTests {

        @Test
        @DisplayName("Should parse numeric value")
        void shouldParseNumber() throws MalformedConfigException {
            KeyValueConfig config = parser.parse(SCAN_INI);

            assertEquals(100.0, config.getDouble("TubeKV"));
            assertEquals(10.0, config.getDouble("TubeMA"));
        }

        @Test
        @DisplayName("Should return null for absent key")
        void shouldReturnNullForAbsent() throws MalformedConfigException {
            assertNull(parser.parse(SCAN_INI).getDouble("Nope"));
        }

        @Test
        @DisplayName("Should reject non-numeric value")
        void shouldRejectNonNumeric() {
            KeyValueConfig config = parser.parse(SCAN_INI);

            assertThrows(MalformedConfigException.class, () -> config.getDouble("CollimatorName"));
        }
    }
}
