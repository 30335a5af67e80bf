package com.hdltree.ast;

import com.hdltree.Span;
import com.hdltree.Token;

import java.util.List;

public record ProtectedTypeDeclaration(
    Span span,
    List<Token> tokens,
    List<Declaration> declarations,
    Identifier endName
) implements TypeDefinition {
    @Override
    public String type() {
        return "ProtectedTypeDeclaration";
    }
}
