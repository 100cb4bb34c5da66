package com.di.eventreplay.model;

import lombok.Builder;
import lombok.Value;

/**
 * Row of {@code principal_stx_txs}: links a principal to a transaction it took part in.
 * The table is unique on {@code (principal, tx_id, index_block_hash, microblock_hash)}.
 */
@Value
@Builder
public class PrincipalStxTx {
    String  principal;
    String  txId;
    long    blockHeight;
    String  indexBlockHash;
    String  microblockHash;
    int     microblockSequence;
    int     txIndex;
    boolean canonical;
    boolean microblockCanonical;
}
