package com.hdltree.ast;

import com.hdltree.Span;
import com.hdltree.Token;

import java.util.List;

public record ElementAssociation(
    Span span,
    List<Token> tokens,
    List<Expression> choices,
    Expression value
) implements Node {
    @Override
    public String type() {
        return "ElementAssociation";
    }
}
