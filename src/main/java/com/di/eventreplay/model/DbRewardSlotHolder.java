package com.di.eventreplay.model;

import lombok.Builder;
import lombok.Value;

/** Row of {@code reward_slot_holders}. */
@Value
@Builder
public class DbRewardSlotHolder {
    String  burnBlockHash;
    long    burnBlockHeight;
    String  address;
    int     slotIndex;
    @Builder.Default
    boolean canonical = true;
}
