package com.di.eventreplay.tsv;

import com.di.eventreplay.exception.EventImportException;
import com.di.eventreplay.exception.ImportErrorKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("TsvLines Tests")
class TsvLinesTest {

    // ============================================================================
    // Raw log lines
    // ============================================================================

    @Test
    @DisplayName("Should take the last field as payload and the one before as path")
    void testParseRaw_FourFields() {
        RawLogLine line = TsvLines.parseRaw("17\t2024-03-01 12:00:00+00\t/new_block\t{\"a\":1}", 5);

        assertEquals("/new_block", line.httpPath());
        assertEquals("{\"a\":1}", line.payload());
        assertEquals(5, line.ordinal());
    }

    @Test
    @DisplayName("Should accept a bare path and payload")
    void testParseRaw_TwoFields() {
        RawLogLine line = TsvLines.parseRaw("/new_mempool_tx\t[]", 1);

        assertEquals("/new_mempool_tx", line.httpPath());
        assertEquals("[]", line.payload());
    }

    @Test
    @DisplayName("Should fail with PARSE_ERROR when there is no tab")
    void testParseRaw_NoTab() {
        EventImportException e = assertThrows(EventImportException.class,
                () -> TsvLines.parseRaw("garbage", 9));
        assertEquals(ImportErrorKind.PARSE_ERROR, e.getKind());
        assertTrue(e.getMessage().contains("Line 9"));
    }

    @Test
    @DisplayName("Should fail with PARSE_ERROR on an empty path")
    void testParseRaw_EmptyPath() {
        EventImportException e = assertThrows(EventImportException.class,
                () -> TsvLines.parseRaw("1\tts\t\t{}", 2));
        assertEquals(ImportErrorKind.PARSE_ERROR, e.getKind());
    }

    // ============================================================================
    // Preorg lines
    // ============================================================================

    @Test
    @DisplayName("Should parse what formatPreorg writes")
    void testParsePreorg_Formatted() {
        String line = TsvLines.formatPreorg(42, "/new_block", "{\"x\":\"y\"}");

        assertEquals("42\t/new_block\t{\"x\":\"y\"}", line);
        PreorgRecord record = TsvLines.parsePreorg(line, 1);
        assertEquals(new PreorgRecord("/new_block", "{\"x\":\"y\"}", 42), record);
    }

    @Test
    @DisplayName("Should reject a preorg line with a bad line count")
    void testParsePreorg_BadCount() {
        EventImportException e = assertThrows(EventImportException.class,
                () -> TsvLines.parsePreorg("abc\t/new_block\t{}", 3));
        assertEquals(ImportErrorKind.PARSE_ERROR, e.getKind());
    }

    @Test
    @DisplayName("Should reject a preorg line with too few fields")
    void testParsePreorg_TooFewFields() {
        assertThrows(EventImportException.class, () -> TsvLines.parsePreorg("1\t/new_block", 3));
    }
}
