package com.di.eventreplay.model;

import lombok.Builder;
import lombok.Value;

/** Row of {@code nft_events}. {@code value} is the hex-encoded Clarity value. */
@Value
@Builder
public class DbNftEvent {
    int            eventIndex;
    String         txId;
    AssetEventType assetEventType;
    String         assetIdentifier;
    String         sender;
    String         recipient;
    String         value;
}
