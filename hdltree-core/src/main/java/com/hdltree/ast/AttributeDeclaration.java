package com.hdltree.ast;

import com.hdltree.Span;
import com.hdltree.Token;

import java.util.List;

public record AttributeDeclaration(
    Span span,
    List<Token> tokens,
    Identifier name,
    Name typeMark
) implements Declaration {
    @Override
    public String type() {
        return "AttributeDeclaration";
    }
}
