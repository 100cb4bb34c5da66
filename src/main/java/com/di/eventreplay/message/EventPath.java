package com.di.eventreplay.message;

/**
 * Observer event paths the importer understands.
 */
public final class EventPath {

    public static final String NEW_BLOCK = "/new_block";
    public static final String NEW_BURN_BLOCK = "/new_burn_block";
    public static final String ATTACHMENTS_NEW = "/attachments/new";

    private EventPath() {
    }
}
