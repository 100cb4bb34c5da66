package com.di.eventreplay.store;

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
import com.di.eventreplay.model.PrincipalStxTx;

import java.util.List;
import java.util.Optional;

/**
 * Destination of an event import.
 *
 * <p>Besides one insert per row type, a store offers a bulk-load mode:
 * {@link #beginBulkPhase} switches off secondary indexes and uniqueness checks
 * for the given tables, {@link #endBulkPhase} switches them back on, and
 * {@link #reindexTable} rebuilds what was skipped. Both toggles run inside
 * {@link #inTransaction} so a rollback also restores the index state.
 *
 * <p>Event rows are inserted with the transaction they belong to, which carries
 * the block and microblock context the rows repeat. Inserts of an empty list are
 * no-ops.
 */
public interface EventImportStore {

    /** Runs {@code work} in one transaction; any exception rolls it back and propagates. */
    void inTransaction(Runnable work);

    void beginBulkPhase(List<String> tables);

    void endBulkPhase(List<String> tables);

    void reindexTable(String table);

    /** Current value of a server setting, for diagnostics only. */
    Optional<String> showSetting(String name);

    // ---- burn blocks -------------------------------------------------------

    void insertBurnchainRewards(List<DbBurnchainReward> rewards);

    void insertRewardSlotHolders(List<DbRewardSlotHolder> slotHolders);

    // ---- attachments -------------------------------------------------------

    void insertZonefile(DbBnsZoneFile zonefile);

    void insertSubdomain(DbBnsSubdomain subdomain);

    // ---- raw observer requests ---------------------------------------------

    void insertRawEventRequest(String eventPath, String payload);

    // ---- blocks ------------------------------------------------------------

    void insertBlock(DbBlock block);

    void insertMicroblocks(List<DbMicroblock> microblocks);

    void insertTxs(List<DbTx> txs);

    void insertPrincipalStxTxs(List<PrincipalStxTx> rows);

    void insertStxEvents(DbTx tx, List<DbStxEvent> events);

    void insertContractLogs(DbTx tx, List<DbSmartContractEvent> events);

    void insertStxLockEvents(DbTx tx, List<DbStxLockEvent> events);

    void insertFtEvents(DbTx tx, List<DbFtEvent> events);

    void insertNftEvents(DbTx tx, List<DbNftEvent> events);

    void insertSmartContracts(DbTx tx, List<DbSmartContract> contracts);

    void insertNames(DbTx tx, List<DbBnsName> names);

    void insertNamespaces(DbTx tx, List<DbBnsNamespace> namespaces);
}
