package org.dxworks.docframe.legacy;

import org.dxworks.docframe.token.Token;

import java.util.List;

/** One category extracted by its own full traversal of the token sequence. */
public interface LegacyExtractor {

    String category();

    Object extract(List<Token> tokens);

    default Object emptyResult() {
        return List.of();
    }
}
