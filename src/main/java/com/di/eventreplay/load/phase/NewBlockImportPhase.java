package com.di.eventreplay.load.phase;

import com.di.eventreplay.load.BatchInserter;
import com.di.eventreplay.load.ImportContext;
import com.di.eventreplay.load.PrincipalStxTxCollector;
import com.di.eventreplay.message.CoreNodeMessageParser;
import com.di.eventreplay.message.EventPath;
import com.di.eventreplay.model.DataStoreBlockUpdateData;
import com.di.eventreplay.model.DataStoreTxEventData;
import com.di.eventreplay.model.DbTx;
import com.di.eventreplay.model.PrincipalStxTx;
import com.di.eventreplay.store.EventImportStore;
import com.di.eventreplay.tsv.PreorgRecord;
import com.di.eventreplay.util.ImportEventLogger;
import com.di.eventreplay.util.ImportMetrics;

import java.util.List;

/**
 * Blocks with everything they confirm. Per block: the block row, its microblocks,
 * then per transaction the tx (batched), STX events, principal links (batched),
 * contract logs, lock events, FT and NFT events, deployed contracts, BNS names
 * and namespaces.
 */
public class NewBlockImportPhase extends ImportPhase {

    public NewBlockImportPhase(EventImportStore store, CoreNodeMessageParser parser,
                               ImportMetrics metrics, ImportEventLogger events) {
        super(store, parser, metrics, events);
    }

    @Override
    public String name() {
        return "new-blocks";
    }

    @Override
    public List<String> tables() {
        return List.of("blocks", "microblocks", "txs", "stx_events", "principal_stx_txs",
                "contract_logs", "stx_lock_events", "ft_events", "nft_events",
                "smart_contracts", "names", "namespaces");
    }

    @Override
    protected String pathFilter() {
        return EventPath.NEW_BLOCK;
    }

    @Override
    protected PhaseWriter newWriter(ImportContext ctx) {
        return new Writer(ctx.config().txBatchSize(), ctx.config().principalBatchSize());
    }

    private final class Writer implements PhaseWriter {

        private final BatchInserter<DbTx>           txs;
        private final BatchInserter<PrincipalStxTx> principals;

        Writer(int txBatchSize, int principalBatchSize) {
            this.txs = new BatchInserter<>(txBatchSize,
                    batch -> insert("txs", "insertTxs", batch.size(), () -> store.insertTxs(batch)));
            this.principals = new BatchInserter<>(principalBatchSize,
                    batch -> insert("principal_stx_txs", "insertPrincipalStxTxs", batch.size(),
                            () -> store.insertPrincipalStxTxs(batch)));
        }

        @Override
        public void write(PreorgRecord record) {
            DataStoreBlockUpdateData data = parser.parseNewBlock(record.payload());
            insert("blocks", "insertBlock", 1, () -> store.insertBlock(data.getBlock()));
            insert("microblocks", "insertMicroblocks", data.getMicroblocks().size(),
                    () -> store.insertMicroblocks(data.getMicroblocks()));

            for (DataStoreTxEventData entry : data.getTxs()) {
                DbTx tx = entry.getTx();
                txs.push(List.of(tx));
                insert("stx_events", "insertStxEvents", entry.getStxEvents().size(),
                        () -> store.insertStxEvents(tx, entry.getStxEvents()));
                principals.push(PrincipalStxTxCollector.collect(entry));
                insert("contract_logs", "insertContractLogs", entry.getContractLogEvents().size(),
                        () -> store.insertContractLogs(tx, entry.getContractLogEvents()));
                insert("stx_lock_events", "insertStxLockEvents", entry.getStxLockEvents().size(),
                        () -> store.insertStxLockEvents(tx, entry.getStxLockEvents()));
                insert("ft_events", "insertFtEvents", entry.getFtEvents().size(),
                        () -> store.insertFtEvents(tx, entry.getFtEvents()));
                insert("nft_events", "insertNftEvents", entry.getNftEvents().size(),
                        () -> store.insertNftEvents(tx, entry.getNftEvents()));
                insert("smart_contracts", "insertSmartContracts", entry.getSmartContracts().size(),
                        () -> store.insertSmartContracts(tx, entry.getSmartContracts()));
                insert("names", "insertNames", entry.getNames().size(),
                        () -> store.insertNames(tx, entry.getNames()));
                insert("namespaces", "insertNamespaces", entry.getNamespaces().size(),
                        () -> store.insertNamespaces(tx, entry.getNamespaces()));
            }
        }

        @Override
        public void flush() {
            txs.flush();
            principals.flush();
        }
    }
}
