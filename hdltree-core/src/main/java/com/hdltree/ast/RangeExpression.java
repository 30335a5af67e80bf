package com.hdltree.ast;

import com.hdltree.Span;
import com.hdltree.Token;

import java.util.List;

public record RangeExpression(
    Span span,
    List<Token> tokens,
    Expression left,
    String direction,
    Expression right
) implements Expression, DiscreteRange {
    @Override
    public String type() {
        return "RangeExpression";
    }
}
