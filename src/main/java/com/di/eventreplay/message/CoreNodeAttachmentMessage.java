package com.di.eventreplay.message;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One element of the {@code /attachments/new} payload array.
 */
@Data
@NoArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public class CoreNodeAttachmentMessage {

    private String   attachmentIndex;
    private String   indexBlockHash;
    private String   blockHeight;
    private String   contentHash;
    private String   contractId;
    private Metadata metadata;
    private String   txId;
    /** Hex-encoded zonefile, {@code 0x}-prefixed. */
    private String   content;

    /** Decoded attachment metadata tuple. */
    @Data
    @NoArgsConstructor
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Metadata {
        private String op;
        private String name;
        private String namespace;
        private String txSender;
    }
}
