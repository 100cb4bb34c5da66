package com.di.eventreplay.model;

import lombok.Builder;
import lombok.Value;

/** Row of {@code microblocks}, derived from the microblock fields of confirmed transactions. */
@Value
@Builder
public class DbMicroblock {
    String  microblockHash;
    int     microblockSequence;
    String  microblockParentHash;
    String  parentIndexBlockHash;
    long    blockHeight;
    String  indexBlockHash;
    String  blockHash;
    @Builder.Default
    boolean canonical = true;
    @Builder.Default
    boolean microblockCanonical = true;
}
