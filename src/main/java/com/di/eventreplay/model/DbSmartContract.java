package com.di.eventreplay.model;

import lombok.Builder;
import lombok.Value;

/** Row of {@code smart_contracts}. */
@Value
@Builder
public class DbSmartContract {
    String  txId;
    String  contractId;
    long    blockHeight;
    Integer clarityVersion;
    String  sourceCode;
    String  abi;
}
