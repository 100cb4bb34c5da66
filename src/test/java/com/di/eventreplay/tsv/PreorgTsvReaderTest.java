package com.di.eventreplay.tsv;

import com.di.eventreplay.exception.EventImportException;
import com.di.eventreplay.exception.ImportErrorKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PreorgTsvReader Tests")
class PreorgTsvReaderTest {

    @TempDir
    Path dir;

    private Path preorg() throws Exception {
        Path file = dir.resolve("events.tsv-preorg");
        Files.write(file, List.of(
                TsvLines.formatPreorg(1, "/new_burn_block", "{\"a\":1}"),
                TsvLines.formatPreorg(3, "/new_block", "{\"b\":2}"),
                "",
                TsvLines.formatPreorg(7, "/new_block", "{\"c\":3}")));
        return file;
    }

    private static List<PreorgRecord> drain(PreorgTsvReader reader) throws Exception {
        List<PreorgRecord> out = new ArrayList<>();
        try (reader) {
            reader.forEachRemaining(out::add);
        }
        return out;
    }

    @Test
    @DisplayName("Should read every record and skip blank lines")
    void testRead_All() throws Exception {
        List<PreorgRecord> records = drain(PreorgTsvReader.open(preorg(), null, 16));

        assertEquals(List.of(
                new PreorgRecord("/new_burn_block", "{\"a\":1}", 1),
                new PreorgRecord("/new_block", "{\"b\":2}", 3),
                new PreorgRecord("/new_block", "{\"c\":3}", 7)), records);
    }

    @Test
    @DisplayName("Should return only records of the filtered path")
    void testRead_Filtered() throws Exception {
        List<PreorgRecord> records = drain(PreorgTsvReader.open(preorg(), "/new_block", 16));

        assertEquals(List.of(3L, 7L), records.stream().map(PreorgRecord::readLineCount).toList());
    }

    @Test
    @DisplayName("Should throw NoSuchElementException past the end")
    void testRead_PastEnd() throws Exception {
        try (PreorgTsvReader reader = PreorgTsvReader.open(preorg(), "/attachments/new", 16)) {
            assertFalse(reader.hasNext());
            assertThrows(NoSuchElementException.class, reader::next);
        }
    }

    @Test
    @DisplayName("Should fail with PARSE_ERROR on a malformed line")
    void testRead_Malformed() throws Exception {
        Path file = dir.resolve("bad-preorg");
        Files.writeString(file, "nope\t/new_block\t{}\n");

        try (PreorgTsvReader reader = PreorgTsvReader.open(file, null, 16)) {
            EventImportException ex = assertThrows(EventImportException.class, reader::hasNext);
            assertEquals(ImportErrorKind.PARSE_ERROR, ex.getKind());
        }
    }

    @Test
    @DisplayName("Should fail with IO_ERROR when the file is missing")
    void testOpen_Missing() {
        EventImportException ex = assertThrows(EventImportException.class,
                () -> PreorgTsvReader.open(dir.resolve("none"), null, 16));

        assertEquals(ImportErrorKind.IO_ERROR, ex.getKind());
    }
}
