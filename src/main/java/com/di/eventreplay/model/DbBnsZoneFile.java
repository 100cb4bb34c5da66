package com.di.eventreplay.model;

import lombok.Builder;
import lombok.Value;

/** Row of {@code zonefiles}. */
@Value
@Builder
public class DbBnsZoneFile {
    String name;
    String zonefile;
    String zonefileHash;
    String txId;
    String indexBlockHash;
}
