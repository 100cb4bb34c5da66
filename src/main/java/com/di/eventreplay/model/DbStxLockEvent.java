package com.di.eventreplay.model;

import lombok.Builder;
import lombok.Value;
import java.math.BigInteger;

/** Row of {@code stx_lock_events}. */
@Value
@Builder
public class DbStxLockEvent {
    int        eventIndex;
    String     txId;
    BigInteger lockedAmount;
    long       unlockHeight;
    String     lockedAddress;
    String     contractName;
}
