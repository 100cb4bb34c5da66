package com.di.eventreplay.tsv;

import com.di.eventreplay.exception.EventImportException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * JSON side file {@code <source>.entitydata} holding the {@link TsvEntityData} of a
 * scanned log. A present file is trusted as is; delete it to force a rescan.
 */
@Slf4j
public class EntityDataCache {

    public static final String SUFFIX = ".entitydata";

    private final ObjectMapper objectMapper;

    public EntityDataCache(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public static Path cachePath(Path source) {
        return source.resolveSibling(source.getFileName() + SUFFIX);
    }

    public Optional<TsvEntityData> load(Path source) {
        Path cache = cachePath(source);
        if (!Files.isRegularFile(cache)) {
            return Optional.empty();
        }
        try {
            TsvEntityData data = objectMapper.readValue(cache.toFile(), TsvEntityData.class);
            log.info("[CACHE] Using {} ({} blocks, {} burn blocks, {} lines)", cache,
                    data.indexBlockHashes().size(), data.burnBlockHashes().size(), data.tsvLineCount());
            return Optional.of(data);
        } catch (IOException e) {
            throw EventImportException.io("Unreadable entity cache " + cache + ", delete it to rescan", e);
        }
    }

    public void store(Path source, TsvEntityData data) {
        Path cache = cachePath(source);
        AtomicFileWriter.write(cache, out -> objectMapper.writeValue(out, data));
        log.info("[CACHE] Wrote {}", cache);
    }
}
