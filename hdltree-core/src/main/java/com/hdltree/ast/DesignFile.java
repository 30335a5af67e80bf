package com.hdltree.ast;

import com.hdltree.Span;
import com.hdltree.Token;

import java.util.List;

/**
 * Root of a parsed source file. Holds the end-of-input token so trailing comments survive rendering.
 */
public record DesignFile(
    Span span,
    List<Token> tokens,
    List<DesignUnit> units
) implements Node {
    @Override
    public String type() {
        return "DesignFile";
    }
}
