package com.hdltree.ast;

import com.hdltree.Span;
import com.hdltree.Token;

import java.util.List;

public record GenerateBody(
    Span span,
    List<Token> tokens,
    List<Declaration> declarations,
    List<ConcurrentStatement> statements,
    Identifier endLabel
) implements Node {
    @Override
    public String type() {
        return "GenerateBody";
    }
}
