package com.hdltree.ast;

import com.hdltree.Span;
import com.hdltree.Token;

import java.util.List;

/**
 * A declared name or label, kept exactly as written.
 */
public record Identifier(
    Span span,
    List<Token> tokens,
    String text
) implements Node {
    @Override
    public String type() {
        return "Identifier";
    }
}
