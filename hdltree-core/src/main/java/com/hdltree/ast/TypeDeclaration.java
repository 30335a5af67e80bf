package com.hdltree.ast;

import com.hdltree.Span;
import com.hdltree.Token;

import java.util.List;

public record TypeDeclaration(
    Span span,
    List<Token> tokens,
    Identifier name,
    TypeDefinition definition  // null for an incomplete declaration
) implements Declaration {
    @Override
    public String type() {
        return "TypeDeclaration";
    }
}
