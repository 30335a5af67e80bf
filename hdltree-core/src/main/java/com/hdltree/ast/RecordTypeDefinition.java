package com.hdltree.ast;

import com.hdltree.Span;
import com.hdltree.Token;

import java.util.List;

public record RecordTypeDefinition(
    Span span,
    List<Token> tokens,
    List<ElementDeclaration> elements,
    Identifier endName
) implements TypeDefinition {
    @Override
    public String type() {
        return "RecordTypeDefinition";
    }
}
