package com.hdltree.ast;

import com.hdltree.Span;
import com.hdltree.Token;

import java.util.List;

public record SecondaryUnit(
    Span span,
    List<Token> tokens,
    Identifier name,
    Literal value
) implements Node {
    @Override
    public String type() {
        return "SecondaryUnit";
    }
}
