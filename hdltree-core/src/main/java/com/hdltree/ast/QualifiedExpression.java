package com.hdltree.ast;

import com.hdltree.Span;
import com.hdltree.Token;

import java.util.List;

public record QualifiedExpression(
    Span span,
    List<Token> tokens,
    Name typeMark,
    Expression operand
) implements Expression {
    @Override
    public String type() {
        return "QualifiedExpression";
    }
}
