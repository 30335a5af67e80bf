package com.hdltree.ast;

import com.hdltree.Span;
import com.hdltree.Token;

import java.util.List;

public record LibraryClause(
    Span span,
    List<Token> tokens,
    List<Identifier> names
) implements ContextItem {
    @Override
    public String type() {
        return "LibraryClause";
    }
}
