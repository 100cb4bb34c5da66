package com.di.eventreplay.model;

/** {@code asset_event_type_id} shared by stx, ft and nft events. */
public enum AssetEventType {
    TRANSFER(1),
    MINT(2),
    BURN(3);

    private final int id;

    AssetEventType(int id) {
        this.id = id;
    }

    public int getId() {
        return id;
    }
}
