package org.dxworks.docframe.collector;

import org.dxworks.docframe.token.Token;
import org.dxworks.docframe.token.TokenKind;
import org.dxworks.docframe.warehouse.Warehouse;

import java.util.List;
import java.util.Set;

/**
 * Extraction unit fed by the {@link Dispatcher}. An instance lives for one document and only
 * receives tokens whose kind is in {@link #interest()}.
 */
public interface Collector {

    /** Category key the result is published under. */
    String name();

    Set<TokenKind> interest();

    default boolean shouldProcess(Token token, Warehouse warehouse) {
        return true;
    }

    void onToken(Token token, Warehouse warehouse);

    /** Produces the category value once every token has been dispatched. */
    Object finish(Warehouse warehouse);

    /** Value published when {@link #finish(Warehouse)} fails. */
    default Object emptyResult() {
        return List.of();
    }
}
