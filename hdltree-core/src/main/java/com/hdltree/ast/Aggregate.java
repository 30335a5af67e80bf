package com.hdltree.ast;

import com.hdltree.Span;
import com.hdltree.Token;

import java.util.List;

public record Aggregate(
    Span span,
    List<Token> tokens,
    List<ElementAssociation> elements
) implements Expression {
    @Override
    public String type() {
        return "Aggregate";
    }
}
