package com.hdltree.ast;

import com.hdltree.Span;
import com.hdltree.Token;

import java.util.List;

public record UnaryExpression(
    Span span,
    List<Token> tokens,
    String operator,
    Expression operand
) implements Expression {
    @Override
    public String type() {
        return "UnaryExpression";
    }
}
