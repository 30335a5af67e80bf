package com.hdltree.ast;

import com.hdltree.Span;
import com.hdltree.Token;

import java.util.List;

public record Signature(
    Span span,
    List<Token> tokens,
    List<Name> parameterTypes,
    Name returnType
) implements Node {
    @Override
    public String type() {
        return "Signature";
    }
}
