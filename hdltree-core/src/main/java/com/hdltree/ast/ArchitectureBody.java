package com.hdltree.ast;

import com.hdltree.Span;
import com.hdltree.Token;

import java.util.List;

public record ArchitectureBody(
    Span span,
    List<Token> tokens,
    Identifier name,
    Identifier entityName,
    List<Declaration> declarations,
    List<ConcurrentStatement> statements,
    Identifier endName
) implements LibraryUnit {
    @Override
    public String type() {
        return "ArchitectureBody";
    }
}
