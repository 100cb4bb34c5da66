package com.di.eventreplay.model;

import lombok.Builder;
import lombok.Value;
import java.math.BigInteger;

/** Row of {@code ft_events}. */
@Value
@Builder
public class DbFtEvent {
    int            eventIndex;
    String         txId;
    AssetEventType assetEventType;
    String         assetIdentifier;
    String         sender;
    String         recipient;
    BigInteger     amount;
}
