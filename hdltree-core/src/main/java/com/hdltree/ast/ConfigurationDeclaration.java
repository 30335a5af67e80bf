package com.hdltree.ast;

import com.hdltree.Span;
import com.hdltree.Token;

import java.util.List;

public record ConfigurationDeclaration(
    Span span,
    List<Token> tokens,
    Identifier name,
    Name entityName,
    List<Declaration> declarations,
    BlockConfiguration block,
    Identifier endName
) implements LibraryUnit {
    @Override
    public String type() {
        return "ConfigurationDeclaration";
    }
}
