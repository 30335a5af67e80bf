package com.hdltree.ast;

import com.hdltree.Span;
import com.hdltree.Token;

import java.util.List;

public record AssertionStatement(
    Span span,
    List<Token> tokens,
    Identifier label,
    boolean postponed,
    Expression condition,
    Expression report,
    Expression severity
) implements ConcurrentStatement, SequentialStatement {
    @Override
    public String type() {
        return "AssertionStatement";
    }
}
