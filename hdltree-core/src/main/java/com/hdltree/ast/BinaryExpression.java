package com.hdltree.ast;

import com.hdltree.Span;
import com.hdltree.Token;

import java.util.List;

public record BinaryExpression(
    Span span,
    List<Token> tokens,
    Expression left,
    String operator,
    Expression right
) implements Expression {
    @Override
    public String type() {
        return "BinaryExpression";
    }
}
