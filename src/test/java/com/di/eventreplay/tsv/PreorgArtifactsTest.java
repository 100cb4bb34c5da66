package com.di.eventreplay.tsv;

import com.di.eventreplay.config.ImportRunConfig;
import com.di.eventreplay.exception.EventImportException;
import com.di.eventreplay.exception.ImportErrorKind;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.List;

import static com.di.eventreplay.TestEvents.GENESIS;
import static com.di.eventreplay.TestEvents.blockLine;
import static com.di.eventreplay.TestEvents.burnLine;
import static com.di.eventreplay.TestEvents.hash;
import static com.di.eventreplay.TestEvents.writeLog;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PreorgArtifacts Tests")
class PreorgArtifactsTest {

    @TempDir
    Path dir;

    private PreorgArtifacts artifacts;
    private Path source;

    @BeforeEach
    void setUp() throws Exception {
        artifacts = new PreorgArtifacts(new ObjectMapper(), ImportRunConfig.defaults());
        source = writeLog(dir, "events.tsv", List.of(
                burnLine(1, hash("f1"), null, 100),
                blockLine(2, hash("a1"), GENESIS, 1),
                blockLine(3, hash("a2"), hash("a1"), 2),
                blockLine(4, hash("b2"), hash("a1"), 2)));
    }

    // ============================================================================
    // Paths
    // ============================================================================

    @Test
    @DisplayName("Should place side files next to the source")
    void testPaths() {
        assertEquals(dir.resolve("events.tsv-preorg"), PreorgArtifacts.preorgPath(source));
        assertEquals(dir.resolve("events.tsv.entitydata"), EntityDataCache.cachePath(source));
    }

    // ============================================================================
    // Prepare
    // ============================================================================

    @Test
    @DisplayName("Should scan and generate on the first run")
    void testPrepare_FirstRun() {
        PreparedImport prepared = artifacts.prepare(source);

        assertTrue(prepared.scanned());
        assertTrue(prepared.generated());
        assertEquals(PreorgArtifacts.preorgPath(source), prepared.preorgPath());
        assertEquals(List.of(hash("a1"), hash("b2")), prepared.entityData().indexBlockHashes());
        assertEquals(List.of(hash("f1")), prepared.entityData().burnBlockHashes());
        assertEquals(4, prepared.entityData().tsvLineCount());
        assertTrue(Files.exists(EntityDataCache.cachePath(source)));
        assertTrue(Files.exists(prepared.preorgPath()));
    }

    @Test
    @DisplayName("Should reuse both side files on the second run without touching them")
    void testPrepare_SecondRunIsIdempotent() throws Exception {
        PreparedImport first = artifacts.prepare(source);
        byte[] cacheBytes = Files.readAllBytes(EntityDataCache.cachePath(source));
        byte[] preorgBytes = Files.readAllBytes(first.preorgPath());
        FileTime preorgModified = Files.getLastModifiedTime(first.preorgPath());

        PreparedImport second = artifacts.prepare(source);

        assertFalse(second.scanned());
        assertFalse(second.generated());
        assertEquals(first.entityData(), second.entityData());
        assertArrayEquals(cacheBytes, Files.readAllBytes(EntityDataCache.cachePath(source)));
        assertArrayEquals(preorgBytes, Files.readAllBytes(second.preorgPath()));
        assertEquals(preorgModified, Files.getLastModifiedTime(second.preorgPath()));
    }

    @Test
    @DisplayName("Should trust an existing entity cache over the log contents")
    void testPrepare_UsesExistingCache() throws Exception {
        new EntityDataCache(new ObjectMapper()).store(source,
                new TsvEntityData(List.of(hash("a1"), hash("a2")), List.of(hash("f1")), 4));

        PreparedImport prepared = artifacts.prepare(source);

        assertFalse(prepared.scanned());
        assertTrue(prepared.generated());
        String preorg = Files.readString(prepared.preorgPath());
        assertTrue(preorg.contains(hash("a2")));
        assertFalse(preorg.contains("\"index_block_hash\":\"" + hash("b2") + "\""));
    }

    @Test
    @DisplayName("Should regenerate the preorg file when only the cache exists")
    void testPrepare_RegeneratesMissingPreorg() throws Exception {
        PreparedImport first = artifacts.prepare(source);
        String before = Files.readString(first.preorgPath());
        Files.delete(first.preorgPath());

        PreparedImport second = artifacts.prepare(source);

        assertFalse(second.scanned());
        assertTrue(second.generated());
        assertEquals(before, Files.readString(second.preorgPath()));
    }

    @Test
    @DisplayName("Should fail with IO_ERROR and write nothing for a missing source")
    void testPrepare_MissingSource() throws Exception {
        Path missing = dir.resolve("absent.tsv");

        EventImportException ex = assertThrows(EventImportException.class, () -> artifacts.prepare(missing));

        assertEquals(ImportErrorKind.IO_ERROR, ex.getKind());
        assertFalse(Files.exists(EntityDataCache.cachePath(missing)));
        assertFalse(Files.exists(PreorgArtifacts.preorgPath(missing)));
        try (var files = Files.list(dir)) {
            assertEquals(List.of(source), files.toList());
        }
    }
}
