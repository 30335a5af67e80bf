package com.hdltree.ast;

import com.hdltree.Span;
import com.hdltree.Token;

import java.util.List;

public record GenerateBranch(
    Span span,
    List<Token> tokens,
    Identifier alternativeLabel,
    Expression condition,
    List<Expression> choices,
    GenerateBody body
) implements Node {
    @Override
    public String type() {
        return "GenerateBranch";
    }
}
