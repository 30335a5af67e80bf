package com.hdltree.ast;

import com.hdltree.Span;
import com.hdltree.Token;

import java.util.List;

public record ParenthesizedExpression(
    Span span,
    List<Token> tokens,
    Expression expression
) implements Expression {
    @Override
    public String type() {
        return "ParenthesizedExpression";
    }
}
