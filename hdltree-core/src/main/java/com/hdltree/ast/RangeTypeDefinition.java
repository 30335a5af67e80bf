package com.hdltree.ast;

import com.hdltree.Span;
import com.hdltree.Token;

import java.util.List;

public record RangeTypeDefinition(
    Span span,
    List<Token> tokens,
    DiscreteRange range
) implements TypeDefinition {
    @Override
    public String type() {
        return "RangeTypeDefinition";
    }
}
