package com.hdltree.ast;

import com.hdltree.Span;
import com.hdltree.Token;

import java.util.List;

public record WaitStatement(
    Span span,
    List<Token> tokens,
    Identifier label,
    List<Name> sensitivity,
    Expression condition,
    Expression timeout
) implements SequentialStatement {
    @Override
    public String type() {
        return "WaitStatement";
    }
}
