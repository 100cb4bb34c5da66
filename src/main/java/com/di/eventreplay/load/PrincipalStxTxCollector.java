package com.di.eventreplay.load;

import com.di.eventreplay.model.DataStoreTxEventData;
import com.di.eventreplay.model.DbStxEvent;
import com.di.eventreplay.model.DbTx;
import com.di.eventreplay.model.PrincipalStxTx;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the {@code principal_stx_txs} rows of one transaction: one row per distinct
 * principal among the sender, the token transfer recipient, the called or deployed
 * contract, and every STX event sender and recipient.
 *
 * <p>The table's unique index is disabled while loading, so duplicates must never
 * reach the store; rows are keyed on {@code (principal, tx_id, index_block_hash,
 * microblock_hash)}.
 */
public final class PrincipalStxTxCollector {

    private PrincipalStxTxCollector() {
    }

    public static List<PrincipalStxTx> collect(DataStoreTxEventData entry) {
        DbTx tx = entry.getTx();
        Map<String, PrincipalStxTx> rows = new LinkedHashMap<>();
        add(rows, tx, tx.getSenderAddress());
        add(rows, tx, tx.getTokenTransferRecipientAddress());
        add(rows, tx, tx.getContractCallContractId());
        add(rows, tx, tx.getSmartContractContractId());
        for (DbStxEvent event : entry.getStxEvents()) {
            add(rows, tx, event.getSender());
            add(rows, tx, event.getRecipient());
        }
        return new ArrayList<>(rows.values());
    }

    static String key(PrincipalStxTx row) {
        return row.getPrincipal() + "," + row.getTxId() + "," + row.getIndexBlockHash() + "," + row.getMicroblockHash();
    }

    private static void add(Map<String, PrincipalStxTx> rows, DbTx tx, String principal) {
        if (principal == null || principal.isEmpty()) {
            return;
        }
        PrincipalStxTx row = PrincipalStxTx.builder()
                .principal(principal)
                .txId(tx.getTxId())
                .blockHeight(tx.getBlockHeight())
                .indexBlockHash(tx.getIndexBlockHash())
                .microblockHash(tx.getMicroblockHash())
                .microblockSequence(tx.getMicroblockSequence())
                .txIndex(tx.getTxIndex())
                .canonical(tx.isCanonical())
                .microblockCanonical(tx.isMicroblockCanonical())
                .build();
        rows.putIfAbsent(key(row), row);
    }
}
