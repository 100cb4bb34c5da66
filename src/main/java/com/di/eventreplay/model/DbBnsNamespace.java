package com.di.eventreplay.model;

import lombok.Builder;
import lombok.Value;

/** Row of {@code namespaces}. */
@Value
@Builder
public class DbBnsNamespace {
    String  namespaceId;
    String  address;
    long    launchedAt;
    long    revealBlock;
    long    readyBlock;
    String  base;
    String  coeff;
    String  nonalphaDiscount;
    String  noVowelDiscount;
    Long    lifetime;
    String  status;
    String  txId;
    int     txIndex;
}
