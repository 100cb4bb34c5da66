package com.di.eventreplay.model;

/** {@code txs.status}. */
public enum TxStatus {
    SUCCESS(1, "success"),
    ABORT_BY_RESPONSE(0, "abort_by_response"),
    ABORT_BY_POST_CONDITION(-1, "abort_by_post_condition");

    private final int id;
    private final String label;

    TxStatus(int id, String label) {
        this.id = id;
        this.label = label;
    }

    public int getId() {
        return id;
    }

    public static TxStatus fromLabel(String label) {
        for (TxStatus s : values()) {
            if (s.label.equals(label)) {
                return s;
            }
        }
        throw new IllegalArgumentException("Unknown tx status: " + label);
    }
}
