package com.hdltree.ast;

import com.hdltree.Span;
import com.hdltree.Token;

import java.util.List;

public record ContextReference(
    Span span,
    List<Token> tokens,
    List<Name> names
) implements ContextItem {
    @Override
    public String type() {
        return "ContextReference";
    }
}
