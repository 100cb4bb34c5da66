package com.di.eventreplay.model;

import lombok.Builder;
import lombok.Value;

/** Row of {@code burnchain_rewards}. */
@Value
@Builder
public class DbBurnchainReward {
    String  burnBlockHash;
    long    burnBlockHeight;
    long    burnAmount;
    String  rewardRecipient;
    long    rewardAmount;
    int     rewardIndex;
    @Builder.Default
    boolean canonical = true;
}
