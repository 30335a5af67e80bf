package com.hdltree.ast;

import com.hdltree.Span;
import com.hdltree.Token;

import java.util.List;

public record EnumerationTypeDefinition(
    Span span,
    List<Token> tokens,
    List<Identifier> literals
) implements TypeDefinition {
    @Override
    public String type() {
        return "EnumerationTypeDefinition";
    }
}
