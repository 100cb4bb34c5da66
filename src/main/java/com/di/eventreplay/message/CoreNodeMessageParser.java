package com.di.eventreplay.message;

import com.di.eventreplay.model.AttachmentData;
import com.di.eventreplay.model.BurnBlockData;
import com.di.eventreplay.model.DataStoreBlockUpdateData;

/**
 * Turns one event payload into the rows it produces. Implementations throw
 * {@link com.di.eventreplay.exception.EventImportException} with
 * {@link com.di.eventreplay.exception.ImportErrorKind#PARSE_ERROR PARSE_ERROR}
 * on malformed JSON or missing required fields; they never skip silently.
 */
public interface CoreNodeMessageParser {

    DataStoreBlockUpdateData parseNewBlock(String payload);

    BurnBlockData parseBurnBlock(String payload);

    AttachmentData parseAttachments(String payload);
}
