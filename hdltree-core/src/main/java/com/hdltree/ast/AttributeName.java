package com.hdltree.ast;

import com.hdltree.Span;
import com.hdltree.Token;

import java.util.List;

public record AttributeName(
    Span span,
    List<Token> tokens,
    Name prefix,
    String attribute,
    Expression argument
) implements Name, DiscreteRange {
    @Override
    public String type() {
        return "AttributeName";
    }
}
