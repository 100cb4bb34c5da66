package com.di.eventreplay.message;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonSetter;
import com.fasterxml.jackson.annotation.Nulls;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Payload of {@code /new_block}.
 *
 * <p>Each transaction entry carries the node's raw fields plus the decoded
 * transaction view ({@code tx_type}, {@code sender_address}, ...) and any decoded
 * BNS operations. Producing that view from {@code raw_tx} is done upstream.
 */
@Data
@NoArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public class CoreNodeBlockMessage {

    private String  blockHash;
    private Long    blockHeight;
    private Long    burnBlockTime;
    private String  burnBlockHash;
    private Long    burnBlockHeight;
    private String  minerTxid;
    private String  indexBlockHash;
    private String  parentIndexBlockHash;
    private String  parentBlockHash;
    private String  parentMicroblock;
    private Integer parentMicroblockSequence;
    private String  parentBurnBlockHash;
    private Long    parentBurnBlockHeight;


    @JsonSetter(nulls = Nulls.AS_EMPTY, contentNulls = Nulls.FAIL)
    private List<Transaction> transactions = new ArrayList<>();
    @JsonSetter(nulls = Nulls.AS_EMPTY, contentNulls = Nulls.FAIL)
    private List<Event>       events = new ArrayList<>();

    @Data
    @NoArgsConstructor
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Transaction {
        private String   txid;
        private Integer  txIndex;
        private String   status;
        private String   rawResult;
        private String   rawTx;
        private JsonNode contractAbi;
        private String   microblockHash;
        private Integer  microblockSequence;
        private String   microblockParentHash;

        // ---- decoded transaction view ----------------------------------------
        private String   txType;
        private String   senderAddress;
        private String   sponsorAddress;
        private Long     nonce;
        private String   feeRate;
        private String   tokenTransferRecipientAddress;
        private String   tokenTransferAmount;
        private String   tokenTransferMemo;
        private String   contractCallContractId;
        private String   contractCallFunctionName;
        private String   smartContractContractId;
        private String   smartContractSourceCode;
        private Integer  clarityVersion;


        @JsonSetter(nulls = Nulls.AS_EMPTY, contentNulls = Nulls.FAIL)
        private List<BnsName>      bnsNames = new ArrayList<>();
        @JsonSetter(nulls = Nulls.AS_EMPTY, contentNulls = Nulls.FAIL)
        private List<BnsNamespace> bnsNamespaces = new ArrayList<>();
    }

    @Data
    @NoArgsConstructor
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class BnsName {
        private String name;
        private String namespaceId;
        private String address;
        private Long   expireBlock;
        private Long   gracePeriod;
        private String zonefileHash;
        private String zonefile;
        private String status;
    }

    @Data
    @NoArgsConstructor
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class BnsNamespace {
        private String namespaceId;
        private String address;
        private Long   launchedAt;
        private Long   revealBlock;
        private Long   readyBlock;
        private String base;
        private String coeff;
        private String nonalphaDiscount;
        private String noVowelDiscount;
        private Long   lifetime;
        private String status;
    }

    @Data
    @NoArgsConstructor
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Event {
        private String  txid;
        private Integer eventIndex;
        private boolean committed = true;
        private String  type;

        private StxAssetEvent  stxTransferEvent;
        private StxAssetEvent  stxMintEvent;
        private StxAssetEvent  stxBurnEvent;
        private StxLockEvent   stxLockEvent;
        private FtAssetEvent   ftTransferEvent;
        private FtAssetEvent   ftMintEvent;
        private FtAssetEvent   ftBurnEvent;
        private NftAssetEvent  nftTransferEvent;
        private NftAssetEvent  nftMintEvent;
        private NftAssetEvent  nftBurnEvent;
        private ContractEvent  contractEvent;
    }

    @Data
    @NoArgsConstructor
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class StxAssetEvent {
        private String sender;
        private String recipient;
        private String amount;
        private String memo;
    }

    @Data
    @NoArgsConstructor
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class StxLockEvent {
        private String lockedAmount;
        private String unlockHeight;
        private String lockedAddress;
        private String contractIdentifier;
    }

    @Data
    @NoArgsConstructor
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class FtAssetEvent {
        private String assetIdentifier;
        private String sender;
        private String recipient;
        private String amount;
    }

    @Data
    @NoArgsConstructor
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class NftAssetEvent {
        private String assetIdentifier;
        private String sender;
        private String recipient;
        private String rawValue;
    }

    @Data
    @NoArgsConstructor
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ContractEvent {
        private String contractIdentifier;
        private String topic;
        private String rawValue;
    }
}
