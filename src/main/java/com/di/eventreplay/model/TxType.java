package com.di.eventreplay.model;

/** {@code txs.type_id}. */
public enum TxType {
    TOKEN_TRANSFER(0, "token_transfer"),
    SMART_CONTRACT(1, "smart_contract"),
    CONTRACT_CALL(2, "contract_call"),
    POISON_MICROBLOCK(3, "poison_microblock"),
    COINBASE(4, "coinbase"),
    TENURE_CHANGE(7, "tenure_change");

    private final int id;
    private final String label;

    TxType(int id, String label) {
        this.id = id;
        this.label = label;
    }

    public int getId() {
        return id;
    }

    public static TxType fromLabel(String label) {
        for (TxType t : values()) {
            if (t.label.equals(label)) {
                return t;
            }
        }
        throw new IllegalArgumentException("Unknown tx_type: " + label);
    }
}
