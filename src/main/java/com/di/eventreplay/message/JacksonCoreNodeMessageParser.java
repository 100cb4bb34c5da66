package com.di.eventreplay.message;

import com.di.eventreplay.exception.EventImportException;
import com.di.eventreplay.model.AssetEventType;
import com.di.eventreplay.model.AttachmentData;
import com.di.eventreplay.model.BurnBlockData;
import com.di.eventreplay.model.DataStoreBlockUpdateData;
import com.di.eventreplay.model.DataStoreTxEventData;
import com.di.eventreplay.model.DbBlock;
import com.di.eventreplay.model.DbBnsName;
import com.di.eventreplay.model.DbBnsNamespace;
import com.di.eventreplay.model.DbBnsSubdomain;
import com.di.eventreplay.model.DbBnsZoneFile;
import com.di.eventreplay.model.DbBurnchainReward;
import com.di.eventreplay.model.DbFtEvent;
import com.di.eventreplay.model.DbMicroblock;
import com.di.eventreplay.model.DbNftEvent;
import com.di.eventreplay.model.DbRewardSlotHolder;
import com.di.eventreplay.model.DbSmartContract;
import com.di.eventreplay.model.DbSmartContractEvent;
import com.di.eventreplay.model.DbStxEvent;
import com.di.eventreplay.model.DbStxLockEvent;
import com.di.eventreplay.model.DbTx;
import com.di.eventreplay.model.TxStatus;
import com.di.eventreplay.model.TxType;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Default {@link CoreNodeMessageParser}: decodes each path into its Jackson schema
 * and maps it to rows. Every row is canonical since only canonical events reach it.
 */
@Slf4j
@Component
public class JacksonCoreNodeMessageParser implements CoreNodeMessageParser {

    /** {@code microblock_sequence} of transactions mined in the anchor block itself. */
    public static final int I32_MAX = Integer.MAX_VALUE;

    private static final String SUBDOMAIN_OP = "name-update";

    private final ObjectMapper om;

    public JacksonCoreNodeMessageParser() {
        this.om = new ObjectMapper();
    }

    /* ==================================================================== */
    /* /new_block                                                            */
    /* ==================================================================== */

    @Override
    public DataStoreBlockUpdateData parseNewBlock(String payload) {
        CoreNodeBlockMessage msg = read(payload, CoreNodeBlockMessage.class, EventPath.NEW_BLOCK);
        require(msg.getIndexBlockHash(), "index_block_hash", EventPath.NEW_BLOCK);
        require(msg.getBlockHash(), "block_hash", EventPath.NEW_BLOCK);
        require(msg.getParentIndexBlockHash(), "parent_index_block_hash", EventPath.NEW_BLOCK);
        require(msg.getBlockHeight(), "block_height", EventPath.NEW_BLOCK);

        DbBlock block = DbBlock.builder()
                .blockHash(msg.getBlockHash())
                .indexBlockHash(msg.getIndexBlockHash())
                .parentIndexBlockHash(msg.getParentIndexBlockHash())
                .parentBlockHash(nullToEmpty(msg.getParentBlockHash()))
                .parentMicroblockHash(nullToEmpty(msg.getParentMicroblock()))
                .parentMicroblockSequence(msg.getParentMicroblockSequence() == null ? 0 : msg.getParentMicroblockSequence())
                .blockHeight(msg.getBlockHeight())
                .burnBlockTime(orZero(msg.getBurnBlockTime()))
                .burnBlockHash(nullToEmpty(msg.getBurnBlockHash()))
                .burnBlockHeight(orZero(msg.getBurnBlockHeight()))
                .minerTxid(nullToEmpty(msg.getMinerTxid()))
                .build();

        Map<String, List<CoreNodeBlockMessage.Event>> eventsByTx = new LinkedHashMap<>();
        for (CoreNodeBlockMessage.Event event : msg.getEvents()) {
            if (!event.isCommitted()) {
                log.debug("[PARSE] skipping uncommitted event {} of tx {}", event.getEventIndex(), event.getTxid());
                continue;
            }
            require(event.getTxid(), "events[].txid", EventPath.NEW_BLOCK);
            eventsByTx.computeIfAbsent(event.getTxid(), k -> new ArrayList<>()).add(event);
        }

        DataStoreBlockUpdateData.DataStoreBlockUpdateDataBuilder result = DataStoreBlockUpdateData.builder().block(block);
        Map<String, DbMicroblock> microblocks = new LinkedHashMap<>();
        for (CoreNodeBlockMessage.Transaction tx : msg.getTransactions()) {
            require(tx.getTxid(), "transactions[].txid", EventPath.NEW_BLOCK);
            List<CoreNodeBlockMessage.Event> txEvents = eventsByTx.getOrDefault(tx.getTxid(), List.of());
            result.tx(parseTx(msg, tx, txEvents));

            String mbHash = tx.getMicroblockHash();
            if (mbHash != null && !mbHash.isEmpty() && !microblocks.containsKey(mbHash)) {
                microblocks.put(mbHash, DbMicroblock.builder()
                        .microblockHash(mbHash)
                        .microblockSequence(tx.getMicroblockSequence() == null ? 0 : tx.getMicroblockSequence())
                        .microblockParentHash(nullToEmpty(tx.getMicroblockParentHash()))
                        .parentIndexBlockHash(msg.getParentIndexBlockHash())
                        .blockHeight(msg.getBlockHeight())
                        .indexBlockHash(msg.getIndexBlockHash())
                        .blockHash(msg.getBlockHash())
                        .build());
            }
        }
        result.microblocks(microblocks.values());
        return result.build();
    }

    private DataStoreTxEventData parseTx(CoreNodeBlockMessage block,
                                         CoreNodeBlockMessage.Transaction tx,
                                         List<CoreNodeBlockMessage.Event> events) {
        require(tx.getTxIndex(), "transactions[].tx_index", EventPath.NEW_BLOCK);
        require(tx.getTxType(), "transactions[].tx_type", EventPath.NEW_BLOCK);
        require(tx.getStatus(), "transactions[].status", EventPath.NEW_BLOCK);

        boolean inMicroblock = tx.getMicroblockHash() != null && !tx.getMicroblockHash().isEmpty();
        TxType type;
        TxStatus status;
        try {
            type = TxType.fromLabel(tx.getTxType());
            status = TxStatus.fromLabel(tx.getStatus());
        } catch (IllegalArgumentException e) {
            throw EventImportException.parse("Invalid " + EventPath.NEW_BLOCK + " tx " + tx.getTxid() + ": " + e.getMessage(), e);
        }

        DbTx dbTx = DbTx.builder()
                .txId(tx.getTxid())
                .txIndex(tx.getTxIndex())
                .rawTx(nullToEmpty(tx.getRawTx()))
                .indexBlockHash(block.getIndexBlockHash())
                .blockHash(block.getBlockHash())
                .blockHeight(block.getBlockHeight())
                .burnBlockTime(orZero(block.getBurnBlockTime()))
                .parentIndexBlockHash(block.getParentIndexBlockHash())
                .parentBlockHash(nullToEmpty(block.getParentBlockHash()))
                .microblockHash(inMicroblock ? tx.getMicroblockHash() : "")
                .microblockSequence(inMicroblock && tx.getMicroblockSequence() != null ? tx.getMicroblockSequence() : I32_MAX)
                .typeId(type)
                .status(status)
                .rawResult(nullToEmpty(tx.getRawResult()))
                .senderAddress(tx.getSenderAddress())
                .sponsorAddress(tx.getSponsorAddress())
                .nonce(orZero(tx.getNonce()))
                .feeRate(bigInt(tx.getFeeRate(), "fee_rate"))
                .tokenTransferRecipientAddress(tx.getTokenTransferRecipientAddress())
                .tokenTransferAmount(tx.getTokenTransferAmount() == null ? null : bigInt(tx.getTokenTransferAmount(), "token_transfer_amount"))
                .tokenTransferMemo(tx.getTokenTransferMemo())
                .contractCallContractId(tx.getContractCallContractId())
                .contractCallFunctionName(tx.getContractCallFunctionName())
                .smartContractContractId(tx.getSmartContractContractId())
                .smartContractSourceCode(tx.getSmartContractSourceCode())
                .smartContractClarityVersion(tx.getClarityVersion())
                .eventCount(events.size())
                .build();

        DataStoreTxEventData.DataStoreTxEventDataBuilder entry = DataStoreTxEventData.builder().tx(dbTx);
        for (CoreNodeBlockMessage.Event event : events) {
            addEvent(entry, dbTx.getTxId(), event);
        }

        if (type == TxType.SMART_CONTRACT) {
            require(tx.getSmartContractContractId(), "transactions[].smart_contract_contract_id", EventPath.NEW_BLOCK);
            entry.smartContract(DbSmartContract.builder()
                    .txId(dbTx.getTxId())
                    .contractId(tx.getSmartContractContractId())
                    .blockHeight(dbTx.getBlockHeight())
                    .clarityVersion(tx.getClarityVersion())
                    .sourceCode(nullToEmpty(tx.getSmartContractSourceCode()))
                    .abi(tx.getContractAbi() == null || tx.getContractAbi().isNull() ? null : tx.getContractAbi().toString())
                    .build());
        }
        for (CoreNodeBlockMessage.BnsName name : tx.getBnsNames()) {
            require(name.getName(), "bns_names[].name", EventPath.NEW_BLOCK);
            entry.name(DbBnsName.builder()
                    .name(name.getName())
                    .namespaceId(name.getNamespaceId())
                    .address(name.getAddress())
                    .registeredAt(dbTx.getBlockHeight())
                    .expireBlock(name.getExpireBlock())
                    .gracePeriod(name.getGracePeriod())
                    .zonefileHash(nullToEmpty(name.getZonefileHash()))
                    .status(name.getStatus())
                    .txId(dbTx.getTxId())
                    .txIndex(dbTx.getTxIndex())
                    .build());
        }
        for (CoreNodeBlockMessage.BnsNamespace ns : tx.getBnsNamespaces()) {
            require(ns.getNamespaceId(), "bns_namespaces[].namespace_id", EventPath.NEW_BLOCK);
            entry.namespace(DbBnsNamespace.builder()
                    .namespaceId(ns.getNamespaceId())
                    .address(ns.getAddress())
                    .launchedAt(ns.getLaunchedAt() == null ? dbTx.getBlockHeight() : ns.getLaunchedAt())
                    .revealBlock(orZero(ns.getRevealBlock()))
                    .readyBlock(orZero(ns.getReadyBlock()))
                    .base(ns.getBase())
                    .coeff(ns.getCoeff())
                    .nonalphaDiscount(ns.getNonalphaDiscount())
                    .noVowelDiscount(ns.getNoVowelDiscount())
                    .lifetime(ns.getLifetime())
                    .status(ns.getStatus())
                    .txId(dbTx.getTxId())
                    .txIndex(dbTx.getTxIndex())
                    .build());
        }
        return entry.build();
    }

    private void addEvent(DataStoreTxEventData.DataStoreTxEventDataBuilder entry,
                          String txId,
                          CoreNodeBlockMessage.Event event) {
        require(event.getEventIndex(), "events[].event_index", EventPath.NEW_BLOCK);
        int idx = event.getEventIndex();
        if (event.getStxTransferEvent() != null) {
            entry.stxEvent(stxEvent(txId, idx, AssetEventType.TRANSFER, event.getStxTransferEvent()));
        } else if (event.getStxMintEvent() != null) {
            entry.stxEvent(stxEvent(txId, idx, AssetEventType.MINT, event.getStxMintEvent()));
        } else if (event.getStxBurnEvent() != null) {
            entry.stxEvent(stxEvent(txId, idx, AssetEventType.BURN, event.getStxBurnEvent()));
        } else if (event.getStxLockEvent() != null) {
            CoreNodeBlockMessage.StxLockEvent lock = event.getStxLockEvent();
            entry.stxLockEvent(DbStxLockEvent.builder()
                    .eventIndex(idx)
                    .txId(txId)
                    .lockedAmount(bigInt(lock.getLockedAmount(), "locked_amount"))
                    .unlockHeight(longExact(lock.getUnlockHeight(), "unlock_height"))
                    .lockedAddress(lock.getLockedAddress())
                    .contractName(lock.getContractIdentifier())
                    .build());
        } else if (event.getFtTransferEvent() != null) {
            entry.ftEvent(ftEvent(txId, idx, AssetEventType.TRANSFER, event.getFtTransferEvent()));
        } else if (event.getFtMintEvent() != null) {
            entry.ftEvent(ftEvent(txId, idx, AssetEventType.MINT, event.getFtMintEvent()));
        } else if (event.getFtBurnEvent() != null) {
            entry.ftEvent(ftEvent(txId, idx, AssetEventType.BURN, event.getFtBurnEvent()));
        } else if (event.getNftTransferEvent() != null) {
            entry.nftEvent(nftEvent(txId, idx, AssetEventType.TRANSFER, event.getNftTransferEvent()));
        } else if (event.getNftMintEvent() != null) {
            entry.nftEvent(nftEvent(txId, idx, AssetEventType.MINT, event.getNftMintEvent()));
        } else if (event.getNftBurnEvent() != null) {
            entry.nftEvent(nftEvent(txId, idx, AssetEventType.BURN, event.getNftBurnEvent()));
        } else if (event.getContractEvent() != null) {
            CoreNodeBlockMessage.ContractEvent ce = event.getContractEvent();
            entry.contractLogEvent(DbSmartContractEvent.builder()
                    .eventIndex(idx)
                    .txId(txId)
                    .contractIdentifier(ce.getContractIdentifier())
                    .topic(ce.getTopic())
                    .value(ce.getRawValue())
                    .build());
        } else {
            throw EventImportException.parse("Unsupported event type '" + event.getType()
                    + "' at index " + idx + " of tx " + txId);
        }
    }

    private DbStxEvent stxEvent(String txId, int idx, AssetEventType type, CoreNodeBlockMessage.StxAssetEvent e) {
        return DbStxEvent.builder()
                .eventIndex(idx)
                .txId(txId)
                .assetEventType(type)
                .sender(e.getSender())
                .recipient(e.getRecipient())
                .amount(bigInt(e.getAmount(), "amount"))
                .memo(e.getMemo())
                .build();
    }

    private DbFtEvent ftEvent(String txId, int idx, AssetEventType type, CoreNodeBlockMessage.FtAssetEvent e) {
        return DbFtEvent.builder()
                .eventIndex(idx)
                .txId(txId)
                .assetEventType(type)
                .assetIdentifier(e.getAssetIdentifier())
                .sender(e.getSender())
                .recipient(e.getRecipient())
                .amount(bigInt(e.getAmount(), "amount"))
                .build();
    }

    private DbNftEvent nftEvent(String txId, int idx, AssetEventType type, CoreNodeBlockMessage.NftAssetEvent e) {
        return DbNftEvent.builder()
                .eventIndex(idx)
                .txId(txId)
                .assetEventType(type)
                .assetIdentifier(e.getAssetIdentifier())
                .sender(e.getSender())
                .recipient(e.getRecipient())
                .value(e.getRawValue())
                .build();
    }

    /* ==================================================================== */
    /* /new_burn_block                                                       */
    /* ==================================================================== */

    @Override
    public BurnBlockData parseBurnBlock(String payload) {
        CoreNodeBurnBlockMessage msg = read(payload, CoreNodeBurnBlockMessage.class, EventPath.NEW_BURN_BLOCK);
        require(msg.getBurnBlockHash(), "burn_block_hash", EventPath.NEW_BURN_BLOCK);
        require(msg.getBurnBlockHeight(), "burn_block_height", EventPath.NEW_BURN_BLOCK);

        BurnBlockData.BurnBlockDataBuilder data = BurnBlockData.builder()
                .burnBlockHash(msg.getBurnBlockHash())
                .burnBlockHeight(msg.getBurnBlockHeight());
        List<CoreNodeBurnBlockMessage.RewardRecipient> recipients = msg.getRewardRecipients();
        for (int i = 0; i < recipients.size(); i++) {
            CoreNodeBurnBlockMessage.RewardRecipient r = recipients.get(i);
            require(r.getRecipient(), "reward_recipients[].recipient", EventPath.NEW_BURN_BLOCK);
            data.reward(DbBurnchainReward.builder()
                    .burnBlockHash(msg.getBurnBlockHash())
                    .burnBlockHeight(msg.getBurnBlockHeight())
                    .burnAmount(orZero(msg.getBurnAmount()))
                    .rewardRecipient(r.getRecipient())
                    .rewardAmount(orZero(r.getAmt()))
                    .rewardIndex(i)
                    .build());
        }
        List<String> holders = msg.getRewardSlotHolders();
        for (int i = 0; i < holders.size(); i++) {
            data.slotHolder(DbRewardSlotHolder.builder()
                    .burnBlockHash(msg.getBurnBlockHash())
                    .burnBlockHeight(msg.getBurnBlockHeight())
                    .address(holders.get(i))
                    .slotIndex(i)
                    .build());
        }
        return data.build();
    }

    /* ==================================================================== */
    /* /attachments/new                                                      */
    /* ==================================================================== */

    @Override
    public AttachmentData parseAttachments(String payload) {
        CoreNodeAttachmentMessage[] messages = read(payload, CoreNodeAttachmentMessage[].class, EventPath.ATTACHMENTS_NEW);
        AttachmentData.AttachmentDataBuilder data = AttachmentData.builder();
        for (CoreNodeAttachmentMessage msg : messages) {
            require(msg, "attachment", EventPath.ATTACHMENTS_NEW);
            require(msg.getIndexBlockHash(), "index_block_hash", EventPath.ATTACHMENTS_NEW);
            require(msg.getMetadata(), "metadata", EventPath.ATTACHMENTS_NEW);
            CoreNodeAttachmentMessage.Metadata meta = msg.getMetadata();
            require(meta.getName(), "metadata.name", EventPath.ATTACHMENTS_NEW);
            require(meta.getNamespace(), "metadata.namespace", EventPath.ATTACHMENTS_NEW);

            String fqn = meta.getName() + "." + meta.getNamespace();
            String zonefile = decodeHexUtf8(msg.getContent());
            String zonefileHash = strip0x(nullToEmpty(msg.getContentHash()));
            data.zoneFile(DbBnsZoneFile.builder()
                    .name(fqn)
                    .zonefile(zonefile)
                    .zonefileHash(zonefileHash)
                    .txId(msg.getTxId())
                    .indexBlockHash(msg.getIndexBlockHash())
                    .build());

            if (!SUBDOMAIN_OP.equals(meta.getOp())) {
                continue;
            }
            List<SubdomainZonefileParser.SubdomainEntry> entries;
            try {
                entries = SubdomainZonefileParser.parse(zonefile);
            } catch (IllegalArgumentException e) {
                throw EventImportException.parse("Bad subdomain zonefile for " + fqn + " in tx " + msg.getTxId(), e);
            }
            for (int i = 0; i < entries.size(); i++) {
                SubdomainZonefileParser.SubdomainEntry sub = entries.get(i);
                data.subdomain(DbBnsSubdomain.builder()
                        .name(fqn)
                        .namespaceId(meta.getNamespace())
                        .fullyQualifiedSubdomain(sub.subdomain() + "." + fqn)
                        .owner(sub.owner())
                        .zonefile(sub.zonefile())
                        .zonefileHash(zonefileDigest(sub.zonefile()))
                        .parentZonefileHash(zonefileHash)
                        .parentZonefileIndex(parseLong(msg.getAttachmentIndex(), "attachment_index"))
                        .blockHeight(parseLong(msg.getBlockHeight(), "block_height"))
                        .txIndex(0)
                        .zonefileOffset(i + 1)
                        .resolver(null)
                        .txId(msg.getTxId())
                        .indexBlockHash(msg.getIndexBlockHash())
                        .build());
            }
        }
        return data.build();
    }

    /* ==================================================================== */
    /* Helpers                                                               */
    /* ==================================================================== */

    private <T> T read(String payload, Class<T> type, String path) {
        try {
            T value = om.readValue(payload, type);
            if (value == null) {
                throw EventImportException.parse("Empty " + path + " payload");
            }
            return value;
        } catch (JsonProcessingException e) {
            throw EventImportException.parse("Malformed " + path + " payload: " + e.getOriginalMessage(), e);
        }
    }

    private static void require(Object value, String field, String path) {
        if (value == null) {
            throw EventImportException.parse("Missing required field '" + field + "' in " + path + " payload");
        }
    }

    private static BigInteger bigInt(String value, String field) {
        if (value == null || value.isEmpty()) {
            throw EventImportException.parse("Missing required integer field '" + field + "'");
        }
        try {
            return new BigInteger(value);
        } catch (NumberFormatException e) {
            throw EventImportException.parse("Field '" + field + "' is not an integer: " + value, e);
        }
    }

    private static long parseLong(String value, String field) {
        return value == null ? 0L : longExact(value, field);
    }

    private static long longExact(String value, String field) {
        try {
            return bigInt(value, field).longValueExact();
        } catch (ArithmeticException e) {
            throw EventImportException.parse("Field '" + field + "' is out of range: " + value, e);
        }
    }

    private static long orZero(Long value) {
        return value == null ? 0L : value;
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }

    private static String strip0x(String hex) {
        return hex.startsWith("0x") ? hex.substring(2) : hex;
    }

    static String decodeHexUtf8(String hex) {
        if (hex == null || hex.isEmpty()) {
            return "";
        }
        try {
            return new String(HexFormat.of().parseHex(strip0x(hex)), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            throw EventImportException.parse("Attachment content is not valid hex", e);
        }
    }

    /** 20-byte (40 hex chars) digest identifying a subdomain zonefile. */
    static String zonefileDigest(String zonefile) {
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(zonefile.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest, 0, 20);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
