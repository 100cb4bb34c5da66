package com.di.eventreplay.model;

import lombok.Builder;
import lombok.Value;

/** Row of {@code contract_logs}. */
@Value
@Builder
public class DbSmartContractEvent {
    int    eventIndex;
    String txId;
    String contractIdentifier;
    String topic;
    String value;
}
