package com.di.eventreplay.load;

import com.di.eventreplay.model.AssetEventType;
import com.di.eventreplay.model.DataStoreTxEventData;
import com.di.eventreplay.model.DbStxEvent;
import com.di.eventreplay.model.DbTx;
import com.di.eventreplay.model.PrincipalStxTx;
import com.di.eventreplay.model.TxStatus;
import com.di.eventreplay.model.TxType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PrincipalStxTxCollector Tests")
class PrincipalStxTxCollectorTest {

    private static DbTx.DbTxBuilder tx() {
        return DbTx.builder()
                .txId("0xt1")
                .txIndex(2)
                .indexBlockHash("0xib")
                .blockHeight(9)
                .microblockHash("")
                .microblockSequence(Integer.MAX_VALUE)
                .typeId(TxType.TOKEN_TRANSFER)
                .status(TxStatus.SUCCESS);
    }

    private static DbStxEvent transfer(int index, String sender, String recipient) {
        return DbStxEvent.builder()
                .eventIndex(index)
                .txId("0xt1")
                .assetEventType(AssetEventType.TRANSFER)
                .sender(sender)
                .recipient(recipient)
                .amount(BigInteger.TEN)
                .build();
    }

    @Test
    @DisplayName("Should collect sender, recipient and event principals once each")
    void testCollect_Distinct() {
        DataStoreTxEventData entry = DataStoreTxEventData.builder()
                .tx(tx().senderAddress("SPA").tokenTransferRecipientAddress("SPB").build())
                .stxEvent(transfer(0, "SPA", "SPB"))
                .stxEvent(transfer(1, "SPB", "SPC"))
                .build();

        List<PrincipalStxTx> rows = PrincipalStxTxCollector.collect(entry);

        assertEquals(List.of("SPA", "SPB", "SPC"), rows.stream().map(PrincipalStxTx::getPrincipal).toList());
        PrincipalStxTx first = rows.get(0);
        assertEquals("0xt1", first.getTxId());
        assertEquals("0xib", first.getIndexBlockHash());
        assertEquals("", first.getMicroblockHash());
        assertEquals(Integer.MAX_VALUE, first.getMicroblockSequence());
        assertEquals(9, first.getBlockHeight());
        assertEquals(2, first.getTxIndex());
        assertTrue(first.isCanonical());
        assertTrue(first.isMicroblockCanonical());
    }

    @Test
    @DisplayName("Should include called and deployed contracts")
    void testCollect_Contracts() {
        DataStoreTxEventData entry = DataStoreTxEventData.builder()
                .tx(tx().senderAddress("SPA")
                        .contractCallContractId("SPA.pool")
                        .smartContractContractId("SPA.token")
                        .build())
                .build();

        assertEquals(List.of("SPA", "SPA.pool", "SPA.token"),
                PrincipalStxTxCollector.collect(entry).stream().map(PrincipalStxTx::getPrincipal).toList());
    }

    @Test
    @DisplayName("Should skip missing and empty principals such as mint senders")
    void testCollect_SkipsEmpty() {
        DataStoreTxEventData entry = DataStoreTxEventData.builder()
                .tx(tx().senderAddress("SPA").tokenTransferRecipientAddress("").build())
                .stxEvent(transfer(0, null, "SPD"))
                .build();

        assertEquals(List.of("SPA", "SPD"),
                PrincipalStxTxCollector.collect(entry).stream().map(PrincipalStxTx::getPrincipal).toList());
    }

    @Test
    @DisplayName("Should key rows on principal, tx, block and microblock")
    void testKey() {
        PrincipalStxTx row = PrincipalStxTx.builder()
                .principal("SPA").txId("0xt1").indexBlockHash("0xib").microblockHash("0xmb").build();

        assertEquals("SPA,0xt1,0xib,0xmb", PrincipalStxTxCollector.key(row));
    }
}
