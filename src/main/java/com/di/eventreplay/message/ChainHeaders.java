package com.di.eventreplay.message;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Minimal views of block-shaped payloads: only the fields canonicalization needs.
 */
public final class ChainHeaders {

    private ChainHeaders() {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record BlockHeader(
            @JsonProperty("index_block_hash") String indexBlockHash,
            @JsonProperty("parent_index_block_hash") String parentIndexBlockHash,
            @JsonProperty("block_height") Long blockHeight) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record BurnBlockHeader(
            @JsonProperty("burn_block_hash") String burnBlockHash,
            @JsonProperty("parent_burn_block_hash") String parentBurnBlockHash,
            @JsonProperty("burn_block_height") Long burnBlockHeight) {
    }
}
