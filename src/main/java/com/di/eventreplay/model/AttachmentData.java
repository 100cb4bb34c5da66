package com.di.eventreplay.model;

import lombok.Builder;
import lombok.Value;
import lombok.Singular;

import java.util.List;

/** Parsed {@code /attachments/new}. */
@Value
@Builder
public class AttachmentData {
    @Singular("zoneFile")
    List<DbBnsZoneFile> zoneFiles;
    @Singular("subdomain")
    List<DbBnsSubdomain> subdomains;
}
