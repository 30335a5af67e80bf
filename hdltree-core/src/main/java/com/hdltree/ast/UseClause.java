package com.hdltree.ast;

import com.hdltree.Span;
import com.hdltree.Token;

import java.util.List;

public record UseClause(
    Span span,
    List<Token> tokens,
    List<Name> names
) implements ContextItem, Declaration {
    @Override
    public String type() {
        return "UseClause";
    }
}
