package com.di.eventreplay.tsv;

import com.di.eventreplay.exception.EventImportException;
import com.di.eventreplay.message.ChainHeaders;
import com.di.eventreplay.message.EventPath;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.Set;

/**
 * Rewrites the raw log into the preorg file, keeping only canonical events:
 * <ul>
 *   <li>{@code /new_block} when its {@code index_block_hash} is canonical</li>
 *   <li>{@code /new_burn_block} when its {@code burn_block_hash} is canonical</li>
 *   <li>a repeated block or burn block line only the first time</li>
 *   <li>{@code /attachments/new} reduced to its canonical attachments, dropped when none remain</li>
 *   <li>excluded paths never</li>
 *   <li>anything else as is</li>
 * </ul>
 * Input order is preserved.
 */
@Slf4j
public class TsvReorgTransform {

    private final ObjectMapper objectMapper;
    private final int          chunkSize;
    private final Set<String>  excludedPaths;

    public TsvReorgTransform(ObjectMapper objectMapper, int chunkSize, Set<String> excludedPaths) {
        this.objectMapper  = objectMapper;
        this.chunkSize     = chunkSize;
        this.excludedPaths = Set.copyOf(excludedPaths);
    }

    /** Stats of one rewrite. */
    public record Result(long linesRead, long linesWritten, long linesDropped, long attachmentsFiltered) {
    }

    public Result transform(Path source, Path target, TsvEntityData entityData) {
        Set<String> blocks = entityData.indexBlockHashSet();
        Set<String> burnBlocks = entityData.burnBlockHashSet();
        long start = System.currentTimeMillis();
        log.info("[REORG] Writing canonical events of {} to {}", source, target);

        Set<String> emittedBlocks = new HashSet<>();
        Set<String> emittedBurnBlocks = new HashSet<>();
        long[] counts = new long[5];
        try (RawLogReader reader = RawLogReader.open(source, chunkSize)) {
            AtomicFileWriter.write(target, out -> {
                while (reader.hasNext()) {
                    RawLogLine line = reader.next();
                    counts[0]++;
                    if (writeIfCanonical(line, blocks, burnBlocks, emittedBlocks, emittedBurnBlocks, out, counts)) {
                        counts[1]++;
                    } else {
                        counts[2]++;
                    }
                }
            });
        } catch (IOException e) {
            throw EventImportException.io("Failed to close " + source, e);
        } catch (UncheckedIOException e) {
            throw EventImportException.io("Failed to read " + source, e.getCause());
        }

        Result result = new Result(counts[0], counts[1], counts[2], counts[3]);
        log.info("[REORG] Done in {} ms: {} events read, {} written, {} dropped ({} repeats), {} attachment lines filtered",
                System.currentTimeMillis() - start, result.linesRead(), result.linesWritten(),
                result.linesDropped(), counts[4], result.attachmentsFiltered());
        return result;
    }

    private boolean writeIfCanonical(RawLogLine line, Set<String> blocks, Set<String> burnBlocks,
                                     Set<String> emittedBlocks, Set<String> emittedBurnBlocks,
                                     BufferedWriter out, long[] counts) throws IOException {
        String path = line.httpPath();
        if (excludedPaths.contains(path)) {
            return false;
        }
        String payload = line.payload();
        switch (path) {
            case EventPath.NEW_BLOCK -> {
                String hash = read(line, ChainHeaders.BlockHeader.class).indexBlockHash();
                if (!blocks.contains(hash)) {
                    return false;
                }
                if (!emittedBlocks.add(hash)) {
                    log.debug("[REORG] Line {}: block {} already written, skipping repeat", line.ordinal(), hash);
                    counts[4]++;
                    return false;
                }
            }
            case EventPath.NEW_BURN_BLOCK -> {
                String hash = read(line, ChainHeaders.BurnBlockHeader.class).burnBlockHash();
                if (!burnBlocks.contains(hash)) {
                    return false;
                }
                if (!emittedBurnBlocks.add(hash)) {
                    log.debug("[REORG] Line {}: burn block {} already written, skipping repeat", line.ordinal(), hash);
                    counts[4]++;
                    return false;
                }
            }
            case EventPath.ATTACHMENTS_NEW -> {
                payload = filterAttachments(line, blocks);
                if (payload == null) {
                    return false;
                }
                if (!payload.equals(line.payload())) {
                    counts[3]++;
                }
            }
            default -> {
                // passes through
            }
        }
        out.write(TsvLines.formatPreorg(line.ordinal(), path, payload));
        out.newLine();
        return true;
    }

    /** @return the payload to write, or {@code null} when no attachment is canonical */
    private String filterAttachments(RawLogLine line, Set<String> blocks) {
        JsonNode root = read(line, JsonNode.class);
        if (!root.isArray()) {
            throw EventImportException.parse("Line " + line.ordinal() + ": " + EventPath.ATTACHMENTS_NEW
                    + " payload is not an array");
        }
        ArrayNode kept = objectMapper.createArrayNode();
        for (JsonNode attachment : root) {
            JsonNode hash = attachment.get("index_block_hash");
            if (hash != null && hash.isTextual() && blocks.contains(hash.asText())) {
                kept.add(attachment);
            }
        }
        if (kept.isEmpty()) {
            return null;
        }
        if (kept.size() == root.size()) {
            return line.payload();
        }
        try {
            return objectMapper.writeValueAsString(kept);
        } catch (JsonProcessingException e) {
            throw EventImportException.parse("Line " + line.ordinal() + ": cannot re-serialize attachments", e);
        }
    }

    private <T> T read(RawLogLine line, Class<T> type) {
        try {
            return objectMapper.readValue(line.payload(), type);
        } catch (JsonProcessingException e) {
            throw EventImportException.parse("Line " + line.ordinal() + ": malformed " + line.httpPath()
                    + " payload: " + e.getOriginalMessage(), e);
        }
    }
}
