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
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Types;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * PostgreSQL {@link EventImportStore} over {@link JdbcTemplate}.
 *
 * <p>Bulk-load mode flips {@code pg_index.indisready} for every index of the phase
 * tables: while it is {@code false} Postgres neither maintains nor checks those
 * indexes. {@code REINDEX TABLE} afterwards rebuilds them and fails on any
 * duplicate that slipped through.
 */
@Repository
@Slf4j
@RequiredArgsConstructor
public class PgEventImportStore implements EventImportStore {

    /** Microblock sequence of rows that are not in a microblock. */
    static final int I32_MAX = Integer.MAX_VALUE;

    private static final Pattern SETTING_NAME = Pattern.compile("[a-z_][a-z0-9_.]*");

    private final JdbcTemplate        jdbc;
    private final TransactionTemplate txTemplate;

    // ------------------------------------------------------------------
    // Transaction / bulk-load mode
    // ------------------------------------------------------------------

    @Override
    public void inTransaction(Runnable work) {
        txTemplate.executeWithoutResult(status -> work.run());
    }

    @Override
    public void beginBulkPhase(List<String> tables) {
        int n = setIndexesReady(tables, false);
        log.info("[BULK] Disabled {} indexes on {}", n, tables);
    }

    @Override
    public void endBulkPhase(List<String> tables) {
        int n = setIndexesReady(tables, true);
        log.info("[BULK] Re-enabled {} indexes on {}", n, tables);
    }

    private int setIndexesReady(List<String> tables, boolean ready) {
        return jdbc.update(con -> {
            PreparedStatement ps = con.prepareStatement("""
                UPDATE pg_index
                   SET indisready = ?
                 WHERE indrelid = ANY (SELECT oid FROM pg_class WHERE relname = ANY (?))
                """);
            ps.setBoolean(1, ready);
            ps.setArray(2, con.createArrayOf("text", tables.toArray()));
            return ps;
        });
    }

    @Override
    public void reindexTable(String table) {
        jdbc.execute("REINDEX TABLE " + qi(table));
    }

    @Override
    public Optional<String> showSetting(String name) {
        if (!SETTING_NAME.matcher(name).matches()) {
            throw new IllegalArgumentException("Invalid setting name: " + name);
        }
        try {
            return Optional.ofNullable(jdbc.queryForObject("SHOW " + name, String.class));
        } catch (DataAccessException e) {
            log.warn("[DIAG] SHOW {} failed: {}", name, e.getMessage());
            return Optional.empty();
        }
    }

    // ------------------------------------------------------------------
    // Burn blocks
    // ------------------------------------------------------------------

    @Override
    public void insertBurnchainRewards(List<DbBurnchainReward> rewards) {
        if (rewards.isEmpty()) {
            return;
        }
        jdbc.batchUpdate("""
            INSERT INTO burnchain_rewards
              (canonical, burn_block_hash, burn_block_height, burn_amount,
               reward_recipient, reward_amount, reward_index)
            VALUES (?,?,?,?, ?,?,?)
            """,
            rewards,
            rewards.size(),
            (ps, r) -> {
                ps.setBoolean(1, r.isCanonical());
                ps.setString(2, r.getBurnBlockHash());
                ps.setLong(3, r.getBurnBlockHeight());
                ps.setBigDecimal(4, BigDecimal.valueOf(r.getBurnAmount()));
                ps.setString(5, r.getRewardRecipient());
                ps.setBigDecimal(6, BigDecimal.valueOf(r.getRewardAmount()));
                ps.setInt(7, r.getRewardIndex());
            });
    }

    @Override
    public void insertRewardSlotHolders(List<DbRewardSlotHolder> slotHolders) {
        if (slotHolders.isEmpty()) {
            return;
        }
        jdbc.batchUpdate("""
            INSERT INTO reward_slot_holders
              (canonical, burn_block_hash, burn_block_height, address, slot_index)
            VALUES (?,?,?,?,?)
            """,
            slotHolders,
            slotHolders.size(),
            (ps, s) -> {
                ps.setBoolean(1, s.isCanonical());
                ps.setString(2, s.getBurnBlockHash());
                ps.setLong(3, s.getBurnBlockHeight());
                ps.setString(4, s.getAddress());
                ps.setInt(5, s.getSlotIndex());
            });
    }

    // ------------------------------------------------------------------
    // Attachments
    // ------------------------------------------------------------------

    @Override
    public void insertZonefile(DbBnsZoneFile z) {
        jdbc.update("""
            INSERT INTO zonefiles (name, zonefile, zonefile_hash, tx_id, index_block_hash)
            VALUES (?,?,?,?,?)
            """, z.getName(), z.getZonefile(), z.getZonefileHash(), z.getTxId(), z.getIndexBlockHash());
    }

    /** Attachments carry no microblock context: rows are anchored with an empty hash. */
    @Override
    public void insertSubdomain(DbBnsSubdomain s) {
        jdbc.update("""
            INSERT INTO subdomains
              (name, namespace_id, fully_qualified_subdomain, owner,
               zonefile_hash, parent_zonefile_hash, parent_zonefile_index,
               block_height, tx_index, zonefile_offset, resolver, canonical,
               tx_id, index_block_hash, parent_index_block_hash,
               microblock_hash, microblock_sequence, microblock_canonical)
            VALUES (?,?,?,?, ?,?,?, ?,?,?,?,?, ?,?,?, ?,?,?)
            """,
            s.getName(), s.getNamespaceId(), s.getFullyQualifiedSubdomain(), s.getOwner(),
            s.getZonefileHash(), s.getParentZonefileHash(), s.getParentZonefileIndex(),
            s.getBlockHeight(), s.getTxIndex(), s.getZonefileOffset(), s.getResolver(), s.isCanonical(),
            s.getTxId(), s.getIndexBlockHash(), "",
            "", I32_MAX, true);
    }

    // ------------------------------------------------------------------
    // Raw observer requests
    // ------------------------------------------------------------------

    @Override
    public void insertRawEventRequest(String eventPath, String payload) {
        jdbc.update("INSERT INTO event_observer_requests (event_path, payload) VALUES (?, ?::jsonb)",
                eventPath, payload);
    }

    // ------------------------------------------------------------------
    // Blocks, microblocks, transactions
    // ------------------------------------------------------------------

    @Override
    public void insertBlock(DbBlock b) {
        jdbc.update("""
            INSERT INTO blocks
              (index_block_hash, block_hash, block_height, burn_block_time,
               burn_block_hash, burn_block_height, miner_txid,
               parent_index_block_hash, parent_block_hash,
               parent_microblock_hash, parent_microblock_sequence, canonical)
            VALUES (?,?,?,?, ?,?,?, ?,?, ?,?,?)
            """,
            b.getIndexBlockHash(), b.getBlockHash(), b.getBlockHeight(), b.getBurnBlockTime(),
            b.getBurnBlockHash(), b.getBurnBlockHeight(), b.getMinerTxid(),
            b.getParentIndexBlockHash(), b.getParentBlockHash(),
            b.getParentMicroblockHash(), b.getParentMicroblockSequence(), b.isCanonical());
    }

    @Override
    public void insertMicroblocks(List<DbMicroblock> microblocks) {
        if (microblocks.isEmpty()) {
            return;
        }
        jdbc.batchUpdate("""
            INSERT INTO microblocks
              (canonical, microblock_canonical, microblock_hash, microblock_sequence,
               microblock_parent_hash, parent_index_block_hash, block_height,
               index_block_hash, block_hash)
            VALUES (?,?,?,?, ?,?,?, ?,?)
            """,
            microblocks,
            microblocks.size(),
            (ps, m) -> {
                ps.setBoolean(1, m.isCanonical());
                ps.setBoolean(2, m.isMicroblockCanonical());
                ps.setString(3, m.getMicroblockHash());
                ps.setInt(4, m.getMicroblockSequence());
                ps.setString(5, m.getMicroblockParentHash());
                ps.setString(6, m.getParentIndexBlockHash());
                ps.setLong(7, m.getBlockHeight());
                ps.setString(8, m.getIndexBlockHash());
                ps.setString(9, m.getBlockHash());
            });
    }

    @Override
    public void insertTxs(List<DbTx> txs) {
        if (txs.isEmpty()) {
            return;
        }
        jdbc.batchUpdate("""
            INSERT INTO txs
              (tx_id, tx_index, raw_tx, index_block_hash, block_hash, block_height,
               burn_block_time, parent_index_block_hash, parent_block_hash,
               microblock_hash, microblock_sequence, microblock_canonical, canonical,
               type_id, status, raw_result, sender_address, sponsor_address, nonce, fee_rate,
               token_transfer_recipient_address, token_transfer_amount, token_transfer_memo,
               contract_call_contract_id, contract_call_function_name,
               smart_contract_contract_id, smart_contract_source_code,
               smart_contract_clarity_version, event_count)
            VALUES (?,?,?,?,?,?, ?,?,?, ?,?,?,?, ?,?,?,?,?,?,?, ?,?,?, ?,?, ?,?, ?,?)
            """,
            txs,
            txs.size(),
            (ps, t) -> {
                ps.setString(1, t.getTxId());
                ps.setInt(2, t.getTxIndex());
                ps.setString(3, t.getRawTx());
                ps.setString(4, t.getIndexBlockHash());
                ps.setString(5, t.getBlockHash());
                ps.setLong(6, t.getBlockHeight());
                ps.setLong(7, t.getBurnBlockTime());
                ps.setString(8, t.getParentIndexBlockHash());
                ps.setString(9, t.getParentBlockHash());
                ps.setString(10, t.getMicroblockHash());
                ps.setInt(11, t.getMicroblockSequence());
                ps.setBoolean(12, t.isMicroblockCanonical());
                ps.setBoolean(13, t.isCanonical());
                ps.setInt(14, t.getTypeId().getId());
                ps.setInt(15, t.getStatus().getId());
                ps.setString(16, t.getRawResult());
                ps.setString(17, t.getSenderAddress());
                ps.setString(18, t.getSponsorAddress());
                ps.setLong(19, t.getNonce());
                setNumeric(ps, 20, t.getFeeRate() == null ? BigInteger.ZERO : t.getFeeRate());
                ps.setString(21, t.getTokenTransferRecipientAddress());
                setNumeric(ps, 22, t.getTokenTransferAmount());
                ps.setString(23, t.getTokenTransferMemo());
                ps.setString(24, t.getContractCallContractId());
                ps.setString(25, t.getContractCallFunctionName());
                ps.setString(26, t.getSmartContractContractId());
                ps.setString(27, t.getSmartContractSourceCode());
                if (t.getSmartContractClarityVersion() != null) ps.setInt(28, t.getSmartContractClarityVersion()); else ps.setNull(28, Types.SMALLINT);
                ps.setInt(29, t.getEventCount());
            });
    }

    @Override
    public void insertPrincipalStxTxs(List<PrincipalStxTx> rows) {
        if (rows.isEmpty()) {
            return;
        }
        jdbc.batchUpdate("""
            INSERT INTO principal_stx_txs
              (principal, tx_id, block_height, index_block_hash, microblock_hash,
               microblock_sequence, tx_index, canonical, microblock_canonical)
            VALUES (?,?,?,?,?, ?,?,?,?)
            """,
            rows,
            rows.size(),
            (ps, p) -> {
                ps.setString(1, p.getPrincipal());
                ps.setString(2, p.getTxId());
                ps.setLong(3, p.getBlockHeight());
                ps.setString(4, p.getIndexBlockHash());
                ps.setString(5, p.getMicroblockHash());
                ps.setInt(6, p.getMicroblockSequence());
                ps.setInt(7, p.getTxIndex());
                ps.setBoolean(8, p.isCanonical());
                ps.setBoolean(9, p.isMicroblockCanonical());
            });
    }

    // ------------------------------------------------------------------
    // Per-transaction rows. The first TX_CONTEXT_COLUMNS columns repeat the tx context.
    // ------------------------------------------------------------------

    private static final String TX_CONTEXT_COLUMNS = """
        tx_id, tx_index, block_height, index_block_hash, parent_index_block_hash,
        microblock_hash, microblock_sequence, microblock_canonical, canonical""";

    private static final int TX_CONTEXT_SIZE = 9;

    @Override
    public void insertStxEvents(DbTx tx, List<DbStxEvent> events) {
        if (events.isEmpty()) {
            return;
        }
        jdbc.batchUpdate("INSERT INTO stx_events (" + TX_CONTEXT_COLUMNS + """
            , event_index, asset_event_type_id, sender, recipient, amount, memo)
            VALUES (?,?,?,?,?,?,?,?,?, ?,?,?,?,?,?)
            """,
            events,
            events.size(),
            (ps, e) -> {
                int i = setTxContext(ps, tx);
                ps.setInt(i++, e.getEventIndex());
                ps.setInt(i++, e.getAssetEventType().getId());
                ps.setString(i++, e.getSender());
                ps.setString(i++, e.getRecipient());
                setNumeric(ps, i++, e.getAmount());
                ps.setString(i, e.getMemo());
            });
    }

    @Override
    public void insertContractLogs(DbTx tx, List<DbSmartContractEvent> events) {
        if (events.isEmpty()) {
            return;
        }
        jdbc.batchUpdate("INSERT INTO contract_logs (" + TX_CONTEXT_COLUMNS + """
            , event_index, contract_identifier, topic, value)
            VALUES (?,?,?,?,?,?,?,?,?, ?,?,?,?)
            """,
            events,
            events.size(),
            (ps, e) -> {
                int i = setTxContext(ps, tx);
                ps.setInt(i++, e.getEventIndex());
                ps.setString(i++, e.getContractIdentifier());
                ps.setString(i++, e.getTopic());
                ps.setString(i, e.getValue());
            });
    }

    @Override
    public void insertStxLockEvents(DbTx tx, List<DbStxLockEvent> events) {
        if (events.isEmpty()) {
            return;
        }
        jdbc.batchUpdate("INSERT INTO stx_lock_events (" + TX_CONTEXT_COLUMNS + """
            , event_index, locked_amount, unlock_height, locked_address, contract_name)
            VALUES (?,?,?,?,?,?,?,?,?, ?,?,?,?,?)
            """,
            events,
            events.size(),
            (ps, e) -> {
                int i = setTxContext(ps, tx);
                ps.setInt(i++, e.getEventIndex());
                setNumeric(ps, i++, e.getLockedAmount());
                ps.setLong(i++, e.getUnlockHeight());
                ps.setString(i++, e.getLockedAddress());
                ps.setString(i, e.getContractName());
            });
    }

    @Override
    public void insertFtEvents(DbTx tx, List<DbFtEvent> events) {
        if (events.isEmpty()) {
            return;
        }
        jdbc.batchUpdate("INSERT INTO ft_events (" + TX_CONTEXT_COLUMNS + """
            , event_index, asset_event_type_id, asset_identifier, amount, sender, recipient)
            VALUES (?,?,?,?,?,?,?,?,?, ?,?,?,?,?,?)
            """,
            events,
            events.size(),
            (ps, e) -> {
                int i = setTxContext(ps, tx);
                ps.setInt(i++, e.getEventIndex());
                ps.setInt(i++, e.getAssetEventType().getId());
                ps.setString(i++, e.getAssetIdentifier());
                setNumeric(ps, i++, e.getAmount());
                ps.setString(i++, e.getSender());
                ps.setString(i, e.getRecipient());
            });
    }

    @Override
    public void insertNftEvents(DbTx tx, List<DbNftEvent> events) {
        if (events.isEmpty()) {
            return;
        }
        jdbc.batchUpdate("INSERT INTO nft_events (" + TX_CONTEXT_COLUMNS + """
            , event_index, asset_event_type_id, asset_identifier, value, sender, recipient)
            VALUES (?,?,?,?,?,?,?,?,?, ?,?,?,?,?,?)
            """,
            events,
            events.size(),
            (ps, e) -> {
                int i = setTxContext(ps, tx);
                ps.setInt(i++, e.getEventIndex());
                ps.setInt(i++, e.getAssetEventType().getId());
                ps.setString(i++, e.getAssetIdentifier());
                ps.setString(i++, e.getValue());
                ps.setString(i++, e.getSender());
                ps.setString(i, e.getRecipient());
            });
    }

    @Override
    public void insertSmartContracts(DbTx tx, List<DbSmartContract> contracts) {
        if (contracts.isEmpty()) {
            return;
        }
        jdbc.batchUpdate("INSERT INTO smart_contracts (" + TX_CONTEXT_COLUMNS + """
            , contract_id, clarity_version, source_code, abi)
            VALUES (?,?,?,?,?,?,?,?,?, ?,?,?,?::jsonb)
            """,
            contracts,
            contracts.size(),
            (ps, c) -> {
                int i = setTxContext(ps, tx);
                ps.setString(i++, c.getContractId());
                if (c.getClarityVersion() != null) ps.setInt(i++, c.getClarityVersion()); else ps.setNull(i++, Types.SMALLINT);
                ps.setString(i++, c.getSourceCode());
                ps.setString(i, c.getAbi());
            });
    }

    @Override
    public void insertNames(DbTx tx, List<DbBnsName> names) {
        if (names.isEmpty()) {
            return;
        }
        jdbc.batchUpdate("INSERT INTO names (" + TX_CONTEXT_COLUMNS + """
            , name, address, registered_at, expire_block, grace_period,
              zonefile_hash, namespace_id, status)
            VALUES (?,?,?,?,?,?,?,?,?, ?,?,?,?,?, ?,?,?)
            """,
            names,
            names.size(),
            (ps, n) -> {
                int i = setTxContext(ps, tx);
                ps.setString(i++, n.getName());
                ps.setString(i++, n.getAddress());
                ps.setLong(i++, n.getRegisteredAt());
                setNullableLong(ps, i++, n.getExpireBlock());
                setNullableLong(ps, i++, n.getGracePeriod());
                ps.setString(i++, n.getZonefileHash());
                ps.setString(i++, n.getNamespaceId());
                ps.setString(i, n.getStatus());
            });
    }

    @Override
    public void insertNamespaces(DbTx tx, List<DbBnsNamespace> namespaces) {
        if (namespaces.isEmpty()) {
            return;
        }
        jdbc.batchUpdate("INSERT INTO namespaces (" + TX_CONTEXT_COLUMNS + """
            , namespace_id, address, launched_at, reveal_block, ready_block,
              base, coeff, nonalpha_discount, no_vowel_discount, lifetime, status)
            VALUES (?,?,?,?,?,?,?,?,?, ?,?,?,?,?, ?::numeric,?::numeric,?::numeric,?::numeric,?,?)
            """,
            namespaces,
            namespaces.size(),
            (ps, n) -> {
                int i = setTxContext(ps, tx);
                ps.setString(i++, n.getNamespaceId());
                ps.setString(i++, n.getAddress());
                ps.setLong(i++, n.getLaunchedAt());
                ps.setLong(i++, n.getRevealBlock());
                ps.setLong(i++, n.getReadyBlock());
                ps.setString(i++, n.getBase());
                ps.setString(i++, n.getCoeff());
                ps.setString(i++, n.getNonalphaDiscount());
                ps.setString(i++, n.getNoVowelDiscount());
                setNullableLong(ps, i++, n.getLifetime());
                ps.setString(i, n.getStatus());
            });
    }

    // ------------------------------------------------------------------

    /** Binds the tx context columns and returns the next parameter index. */
    private static int setTxContext(PreparedStatement ps, DbTx tx) throws SQLException {
        ps.setString(1, tx.getTxId());
        ps.setInt(2, tx.getTxIndex());
        ps.setLong(3, tx.getBlockHeight());
        ps.setString(4, tx.getIndexBlockHash());
        ps.setString(5, tx.getParentIndexBlockHash());
        ps.setString(6, tx.getMicroblockHash());
        ps.setInt(7, tx.getMicroblockSequence());
        ps.setBoolean(8, tx.isMicroblockCanonical());
        ps.setBoolean(9, tx.isCanonical());
        return TX_CONTEXT_SIZE + 1;
    }

    private static void setNumeric(PreparedStatement ps, int index, BigInteger value) throws SQLException {
        if (value != null) ps.setBigDecimal(index, new BigDecimal(value)); else ps.setNull(index, Types.NUMERIC);
    }

    private static void setNullableLong(PreparedStatement ps, int index, Long value) throws SQLException {
        if (value != null) ps.setLong(index, value); else ps.setNull(index, Types.BIGINT);
    }

    /** Quotes a Postgres identifier. */
    static String qi(String name) {
        return "\"" + name.replace("\"", "\"\"") + "\"";
    }
}
