package com.di.eventreplay.model;

import lombok.Builder;
import lombok.Value;

/** Row of {@code blocks}. */
@Value
@Builder
public class DbBlock {
    String  blockHash;
    String  indexBlockHash;
    String  parentIndexBlockHash;
    String  parentBlockHash;
    String  parentMicroblockHash;
    int     parentMicroblockSequence;
    long    blockHeight;
    long    burnBlockTime;
    String  burnBlockHash;
    long    burnBlockHeight;
    String  minerTxid;
    @Builder.Default
    boolean canonical = true;
}
