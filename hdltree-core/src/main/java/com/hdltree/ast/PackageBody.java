package com.hdltree.ast;

import com.hdltree.Span;
import com.hdltree.Token;

import java.util.List;

public record PackageBody(
    Span span,
    List<Token> tokens,
    Identifier name,
    List<Declaration> declarations,
    Identifier endName
) implements LibraryUnit, Declaration {
    @Override
    public String type() {
        return "PackageBody";
    }
}
