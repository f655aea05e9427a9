package com.factory.edge.r2dbc.store;

import com.factory.edge.core.chain.ChainSigner;

/**
 * Last appended row: the next event gets {@code localId + 1} and chains onto
 * {@code signature}.
 */
public record ChainTail(long localId, String signature) {

    public static final ChainTail EMPTY = new ChainTail(0L, ChainSigner.GENESIS);
}
