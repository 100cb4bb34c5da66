package com.di.eventreplay.model;

import lombok.Builder;
import lombok.Value;

/** Row of {@code subdomains}. */
@Value
@Builder
public class DbBnsSubdomain {
    String  name;
    String  namespaceId;
    String  fullyQualifiedSubdomain;
    String  owner;
    String  zonefile;
    String  zonefileHash;
    String  parentZonefileHash;
    long    parentZonefileIndex;
    long    blockHeight;
    int     txIndex;
    int     zonefileOffset;
    String  resolver;
    String  txId;
    String  indexBlockHash;
    @Builder.Default
    boolean canonical = true;
}
