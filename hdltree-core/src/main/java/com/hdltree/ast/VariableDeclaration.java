package com.hdltree.ast;

import com.hdltree.Span;
import com.hdltree.Token;

import java.util.List;

public record VariableDeclaration(
    Span span,
    List<Token> tokens,
    boolean shared,
    List<Identifier> names,
    SubtypeIndication subtype,
    Expression value
) implements Declaration {
    @Override
    public String type() {
        return "VariableDeclaration";
    }
}
