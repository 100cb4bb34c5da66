package com.di.eventreplay.model;

import lombok.Builder;
import lombok.Value;
import lombok.Singular;

import java.util.List;

/** A transaction with everything that hangs off it in one {@code /new_block}. */
@Value
@Builder
public class DataStoreTxEventData {
    DbTx tx;
    @Singular("stxEvent")
    List<DbStxEvent> stxEvents;
    @Singular("stxLockEvent")
    List<DbStxLockEvent> stxLockEvents;
    @Singular("ftEvent")
    List<DbFtEvent> ftEvents;
    @Singular("nftEvent")
    List<DbNftEvent> nftEvents;
    @Singular("contractLogEvent")
    List<DbSmartContractEvent> contractLogEvents;
    @Singular("smartContract")
    List<DbSmartContract> smartContracts;
    @Singular("name")
    List<DbBnsName> names;
    @Singular("namespace")
    List<DbBnsNamespace> namespaces;
}
