package com.hdltree;

import com.hdltree.ast.DesignFile;

import java.util.List;

/**
 * A successfully transformed design file and the constructs that were dropped from it.
 * Strict parses always have an empty {@code unsupported} list.
 */
public record ParseResult(DesignFile designFile, List<UnsupportedConstruct> unsupported) {

    public ParseResult {
        unsupported = List.copyOf(unsupported);
    }
}
