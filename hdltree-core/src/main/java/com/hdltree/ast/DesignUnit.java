package com.hdltree.ast;

import com.hdltree.Span;
import com.hdltree.Token;

import java.util.List;

public record DesignUnit(
    Span span,
    List<Token> tokens,
    List<ContextItem> contextItems,
    LibraryUnit unit
) implements Node {
    @Override
    public String type() {
        return "DesignUnit";
    }
}
