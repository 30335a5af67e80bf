package com.hdltree.ast;

import com.hdltree.Span;
import com.hdltree.Token;

import java.util.List;

public record RangeConstraint(
    Span span,
    List<Token> tokens,
    DiscreteRange range
) implements Constraint {
    @Override
    public String type() {
        return "RangeConstraint";
    }
}
