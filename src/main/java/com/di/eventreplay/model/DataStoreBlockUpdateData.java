package com.di.eventreplay.model;

import lombok.Builder;
import lombok.Value;
import lombok.Singular;

import java.util.List;

/** Parsed {@code /new_block}: the block, confirmed microblocks and its transactions in order. */
@Value
@Builder
public class DataStoreBlockUpdateData {
    DbBlock block;
    @Singular("microblock")
    List<DbMicroblock> microblocks;
    @Singular("tx")
    List<DataStoreTxEventData> txs;
}
