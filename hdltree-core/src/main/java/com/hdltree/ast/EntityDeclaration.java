package com.hdltree.ast;

import com.hdltree.Span;
import com.hdltree.Token;

import java.util.List;

public record EntityDeclaration(
    Span span,
    List<Token> tokens,
    Identifier name,
    GenericClause generics,
    PortClause ports,
    List<Declaration> declarations,
    List<ConcurrentStatement> statements,
    Identifier endName
) implements LibraryUnit {
    @Override
    public String type() {
        return "EntityDeclaration";
    }
}
