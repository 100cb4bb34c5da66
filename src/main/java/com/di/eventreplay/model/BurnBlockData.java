package com.di.eventreplay.model;

import lombok.Builder;
import lombok.Value;
import lombok.Singular;

import java.util.List;

/** Parsed {@code /new_burn_block}. */
@Value
@Builder
public class BurnBlockData {
    String burnBlockHash;
    long   burnBlockHeight;
    @Singular("reward")
    List<DbBurnchainReward> rewards;
    @Singular("slotHolder")
    List<DbRewardSlotHolder> slotHolders;
}
