package com.di.eventreplay.message;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonSetter;
import com.fasterxml.jackson.annotation.Nulls;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Payload of {@code /new_burn_block}.
 */
@Data
@NoArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public class CoreNodeBurnBlockMessage {

    private String burnBlockHash;
    private Long   burnBlockHeight;
    /** Absent in older node versions; canonical burn history then falls back to heights. */
    private String parentBurnBlockHash;
    private Long   burnAmount;


    @JsonSetter(nulls = Nulls.AS_EMPTY, contentNulls = Nulls.FAIL)
    private List<RewardRecipient> rewardRecipients = new ArrayList<>();
    @JsonSetter(nulls = Nulls.AS_EMPTY, contentNulls = Nulls.FAIL)
    private List<String>          rewardSlotHolders = new ArrayList<>();

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class RewardRecipient {
        private String recipient;
        private Long   amt;
    }
}
