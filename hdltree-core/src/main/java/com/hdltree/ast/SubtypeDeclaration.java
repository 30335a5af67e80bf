package com.hdltree.ast;

import com.hdltree.Span;
import com.hdltree.Token;

import java.util.List;

public record SubtypeDeclaration(
    Span span,
    List<Token> tokens,
    Identifier name,
    SubtypeIndication subtype
) implements Declaration {
    @Override
    public String type() {
        return "SubtypeDeclaration";
    }
}
