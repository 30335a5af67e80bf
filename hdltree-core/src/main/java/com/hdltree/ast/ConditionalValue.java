package com.hdltree.ast;

import com.hdltree.Span;
import com.hdltree.Token;

import java.util.List;

public record ConditionalValue(
    Span span,
    List<Token> tokens,
    Expression value,
    Expression condition
) implements Node {
    @Override
    public String type() {
        return "ConditionalValue";
    }
}
