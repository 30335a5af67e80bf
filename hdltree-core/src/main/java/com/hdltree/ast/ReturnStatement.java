package com.hdltree.ast;

import com.hdltree.Span;
import com.hdltree.Token;

import java.util.List;

public record ReturnStatement(
    Span span,
    List<Token> tokens,
    Identifier label,
    Expression value
) implements SequentialStatement {
    @Override
    public String type() {
        return "ReturnStatement";
    }
}
