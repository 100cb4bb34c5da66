package com.di.eventreplay.model;

import lombok.Builder;
import lombok.Value;
import java.math.BigInteger;

/**
 * Row of {@code txs}. Block context is copied in so the row can be batch-inserted
 * independently of its block.
 */
@Value
@Builder
public class DbTx {
    String     txId;
    int        txIndex;
    String     rawTx;
    String     indexBlockHash;
    String     blockHash;
    long       blockHeight;
    long       burnBlockTime;
    String     parentIndexBlockHash;
    String     parentBlockHash;
    String     microblockHash;
    int        microblockSequence;
    @Builder.Default
    boolean    microblockCanonical = true;
    @Builder.Default
    boolean    canonical = true;
    TxType     typeId;
    TxStatus   status;
    String     rawResult;
    String     senderAddress;
    String     sponsorAddress;
    long       nonce;
    BigInteger feeRate;
    String     tokenTransferRecipientAddress;
    BigInteger tokenTransferAmount;
    String     tokenTransferMemo;
    String     contractCallContractId;
    String     contractCallFunctionName;
    String     smartContractContractId;
    String     smartContractSourceCode;
    Integer    smartContractClarityVersion;
    int        eventCount;
}
