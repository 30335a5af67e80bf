package com.hdltree.ast;

import com.hdltree.Span;
import com.hdltree.Token;

import java.util.List;

public record ElementDeclaration(
    Span span,
    List<Token> tokens,
    List<Identifier> names,
    SubtypeIndication subtype
) implements Node {
    @Override
    public String type() {
        return "ElementDeclaration";
    }
}
