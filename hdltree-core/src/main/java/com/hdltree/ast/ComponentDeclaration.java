package com.hdltree.ast;

import com.hdltree.Span;
import com.hdltree.Token;

import java.util.List;

public record ComponentDeclaration(
    Span span,
    List<Token> tokens,
    Identifier name,
    GenericClause generics,
    PortClause ports,
    Identifier endName
) implements Declaration {
    @Override
    public String type() {
        return "ComponentDeclaration";
    }
}
