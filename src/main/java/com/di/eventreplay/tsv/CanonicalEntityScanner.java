package com.di.eventreplay.tsv;

import com.di.eventreplay.exception.EventImportException;
import com.di.eventreplay.message.ChainHeaders;
import com.di.eventreplay.message.EventPath;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Single forward pass over the raw log that determines the canonical block and
 * burn block hashes.
 *
 * <p>For each chain the scanner keeps {@code hash -> parent} and the last tip seen.
 * After the pass it walks parents back from the final tip until it reaches a hash
 * it never saw, then reverses the walk so ancestors come first. Siblings that lost
 * a fork are simply never visited.
 *
 * <p>Burn blocks logged without {@code parent_burn_block_hash} are resolved by
 * height instead: a block at height {@code h} replaces whatever was recorded at
 * {@code h} and discards every block above it, the way a live follower would have
 * applied them.
 */
@Slf4j
public class CanonicalEntityScanner {

    private final ObjectMapper objectMapper;
    private final int          chunkSize;

    public CanonicalEntityScanner(ObjectMapper objectMapper, int chunkSize) {
        this.objectMapper = objectMapper;
        this.chunkSize    = chunkSize;
    }

    public TsvEntityData scan(Path source) {
        long start = System.currentTimeMillis();
        log.info("[SCAN] Scanning {} for canonical blocks", source);
        try (RawLogReader reader = RawLogReader.open(source, chunkSize)) {
            TsvEntityData data = scan(reader);
            data = new TsvEntityData(data.indexBlockHashes(), data.burnBlockHashes(), reader.linesRead());
            log.info("[SCAN] Done in {} ms: {} lines, {} canonical blocks, {} canonical burn blocks",
                    System.currentTimeMillis() - start, data.tsvLineCount(),
                    data.indexBlockHashes().size(), data.burnBlockHashes().size());
            return data;
        } catch (IOException e) {
            throw EventImportException.io("Failed to close " + source, e);
        } catch (UncheckedIOException e) {
            throw EventImportException.io("Failed to read " + source, e.getCause());
        }
    }

    /**
     * Scans already-split lines. {@code tsvLineCount} is the ordinal of the last line.
     */
    public TsvEntityData scan(Iterator<RawLogLine> lines) {
        ChainTracker blocks = new ChainTracker("block");
        ChainTracker burnBlocks = new ChainTracker("burn block");
        TreeMap<Long, String> burnByHeight = new TreeMap<>();
        boolean burnTipHasParent = false;
        long lastOrdinal = 0;

        while (lines.hasNext()) {
            RawLogLine line = lines.next();
            lastOrdinal = line.ordinal();
            switch (line.httpPath()) {
                case EventPath.NEW_BLOCK -> {
                    ChainHeaders.BlockHeader header = readHeader(line, ChainHeaders.BlockHeader.class);
                    requireField(header.indexBlockHash(), "index_block_hash", line);
                    requireField(header.parentIndexBlockHash(), "parent_index_block_hash", line);
                    blocks.record(header.indexBlockHash(), header.parentIndexBlockHash());
                }
                case EventPath.NEW_BURN_BLOCK -> {
                    ChainHeaders.BurnBlockHeader header = readHeader(line, ChainHeaders.BurnBlockHeader.class);
                    requireField(header.burnBlockHash(), "burn_block_hash", line);
                    requireField(header.burnBlockHeight(), "burn_block_height", line);
                    String parent = header.parentBurnBlockHash();
                    burnTipHasParent = parent != null && !parent.isEmpty();
                    burnBlocks.record(header.burnBlockHash(), burnTipHasParent ? parent : null);
                    burnByHeight.tailMap(header.burnBlockHeight(), true).clear();
                    burnByHeight.put(header.burnBlockHeight(), header.burnBlockHash());
                }
                default -> {
                    // other paths carry no chain structure
                }
            }
        }

        List<String> canonicalBlocks = blocks.walkFromTip();
        List<String> canonicalBurnBlocks;
        if (burnBlocks.isEmpty() || burnTipHasParent) {
            canonicalBurnBlocks = burnBlocks.walkFromTip();
        } else {
            log.info("[SCAN] Burn tip has no parent hash, resolving {} burn blocks by height", burnBlocks.size());
            canonicalBurnBlocks = new ArrayList<>(burnByHeight.values());
        }
        log.debug("[SCAN] blocks seen={} canonical={}; burn blocks seen={} canonical={}",
                blocks.size(), canonicalBlocks.size(), burnBlocks.size(), canonicalBurnBlocks.size());
        return new TsvEntityData(canonicalBlocks, canonicalBurnBlocks, lastOrdinal);
    }

    /** {@code true} for the all-zero parent hash of the first block of a chain. */
    static boolean isGenesisParent(String hash) {
        if (hash == null) {
            return false;
        }
        String hex = hash.startsWith("0x") ? hash.substring(2) : hash;
        if (hex.isEmpty()) {
            return false;
        }
        for (int i = 0; i < hex.length(); i++) {
            if (hex.charAt(i) != '0') {
                return false;
            }
        }
        return true;
    }

    private <T> T readHeader(RawLogLine line, Class<T> type) {
        try {
            return objectMapper.readValue(line.payload(), type);
        } catch (JsonProcessingException e) {
            throw EventImportException.parse("Line " + line.ordinal() + ": malformed " + line.httpPath()
                    + " payload: " + e.getOriginalMessage(), e);
        }
    }

    private static void requireField(Object value, String field, RawLogLine line) {
        if (value == null) {
            throw EventImportException.parse("Line " + line.ordinal() + ": " + line.httpPath()
                    + " payload has no " + field);
        }
    }

    /** Parent pointers and last tip of one chain. */
    private static final class ChainTracker {

        private final String label;
        private final Map<String, String> parents = new HashMap<>();
        private String tip;

        ChainTracker(String label) {
            this.label = label;
        }

        void record(String hash, String parent) {
            parents.put(hash, parent);
            tip = hash;
        }

        boolean isEmpty() {
            return tip == null;
        }

        int size() {
            return parents.size();
        }

        List<String> walkFromTip() {
            if (tip == null) {
                return List.of();
            }
            List<String> chain = new ArrayList<>();
            Set<String> visited = new HashSet<>();
            String current = tip;
            while (current != null && parents.containsKey(current)) {
                if (!visited.add(current)) {
                    log.warn("[SCAN] Cycle in {} parents at {}, stopping walk", label, current);
                    break;
                }
                chain.add(current);
                current = parents.get(current);
            }
            if (current != null && !parents.containsKey(current) && !isGenesisParent(current)) {
                log.warn("[SCAN] Missing {} {} (log truncated?), canonical history starts at its child", label, current);
            }
            Collections.reverse(chain);
            return chain;
        }
    }
}
