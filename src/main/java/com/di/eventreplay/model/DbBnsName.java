package com.di.eventreplay.model;

import lombok.Builder;
import lombok.Value;

/** Row of {@code names}. */
@Value
@Builder
public class DbBnsName {
    String  name;
    String  namespaceId;
    String  address;
    long    registeredAt;
    Long    expireBlock;
    Long    gracePeriod;
    String  zonefileHash;
    String  status;
    String  txId;
    int     txIndex;
}
