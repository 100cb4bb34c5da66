package com.di.eventreplay.model;

import lombok.Builder;
import lombok.Value;
import java.math.BigInteger;

/** Row of {@code stx_events}. */
@Value
@Builder
public class DbStxEvent {
    int            eventIndex;
    String         txId;
    AssetEventType assetEventType;
    String         sender;
    String         recipient;
    BigInteger     amount;
    String         memo;
}
