package com.hdltree.ast;

import com.hdltree.Span;
import com.hdltree.Token;

import java.util.List;

public record SimpleName(
    Span span,
    List<Token> tokens,
    String identifier
) implements Name {
    @Override
    public String type() {
        return "SimpleName";
    }
}
