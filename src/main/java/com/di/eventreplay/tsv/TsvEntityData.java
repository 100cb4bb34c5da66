package com.di.eventreplay.tsv;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Canonical index of an event log: the canonical block and burn block hashes,
 * ancestor first, and the number of lines in the source file.
 */
public record TsvEntityData(
        @JsonProperty("indexBlockHashes") List<String> indexBlockHashes,
        @JsonProperty("burnBlockHashes") List<String> burnBlockHashes,
        @JsonProperty("tsvLineCount") long tsvLineCount) {

    public TsvEntityData {
        indexBlockHashes = indexBlockHashes == null ? List.of() : List.copyOf(indexBlockHashes);
        burnBlockHashes = burnBlockHashes == null ? List.of() : List.copyOf(burnBlockHashes);
    }

    /** Membership view of {@link #indexBlockHashes()}. */
    public Set<String> indexBlockHashSet() {
        return new LinkedHashSet<>(indexBlockHashes);
    }

    /** Membership view of {@link #burnBlockHashes()}. */
    public Set<String> burnBlockHashSet() {
        return new LinkedHashSet<>(burnBlockHashes);
    }
}
