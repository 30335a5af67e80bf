package com.hdltree.ast;

import com.hdltree.Span;
import com.hdltree.Token;

import java.util.List;

public record ContextDeclaration(
    Span span,
    List<Token> tokens,
    Identifier name,
    List<ContextItem> items,
    Identifier endName
) implements LibraryUnit {
    @Override
    public String type() {
        return "ContextDeclaration";
    }
}
