package com.di.eventreplay.tsv;

import com.di.eventreplay.config.ImportRunConfig;
import com.di.eventreplay.exception.EventImportException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Produces the two side files of an event log, reusing whichever already exist:
 * {@code <source>.entitydata} (canonical index) and {@code <source>-preorg}
 * (canonical events only). A re-run over the same log does no scanning or
 * rewriting.
 */
@Slf4j
public class PreorgArtifacts {

    public static final String PREORG_SUFFIX = "-preorg";

    private final EntityDataCache        cache;
    private final CanonicalEntityScanner scanner;
    private final TsvReorgTransform      transform;

    public PreorgArtifacts(ObjectMapper objectMapper, ImportRunConfig config) {
        this(new EntityDataCache(objectMapper),
             new CanonicalEntityScanner(objectMapper, config.readChunkSize()),
             new TsvReorgTransform(objectMapper, config.readChunkSize(), config.excludedPaths()));
    }

    public PreorgArtifacts(EntityDataCache cache, CanonicalEntityScanner scanner, TsvReorgTransform transform) {
        this.cache     = cache;
        this.scanner   = scanner;
        this.transform = transform;
    }

    public static Path preorgPath(Path source) {
        return source.resolveSibling(source.getFileName() + PREORG_SUFFIX);
    }

    public PreparedImport prepare(Path source) {
        if (!Files.isRegularFile(source) || !Files.isReadable(source)) {
            throw EventImportException.io("Event log " + source + " does not exist or is not readable", null);
        }

        Optional<TsvEntityData> cached = cache.load(source);
        TsvEntityData entityData;
        boolean scanned = cached.isEmpty();
        if (scanned) {
            entityData = scanner.scan(source);
            cache.store(source, entityData);
        } else {
            entityData = cached.get();
        }

        Path preorg = preorgPath(source);
        boolean generated = !Files.exists(preorg);
        if (generated) {
            transform.transform(source, preorg, entityData);
        } else {
            log.info("[REORG] Reusing existing {}", preorg);
        }
        return new PreparedImport(entityData, preorg, scanned, generated);
    }
}
