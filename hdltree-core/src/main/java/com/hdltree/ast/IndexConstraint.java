package com.hdltree.ast;

import com.hdltree.Span;
import com.hdltree.Token;

import java.util.List;

public record IndexConstraint(
    Span span,
    List<Token> tokens,
    List<DiscreteRange> ranges,
    boolean open
) implements Constraint {
    @Override
    public String type() {
        return "IndexConstraint";
    }
}
