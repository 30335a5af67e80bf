package com.hdltree.ast;

import com.hdltree.Span;
import com.hdltree.Token;

import java.util.List;

public record GenerateStatement(
    Span span,
    List<Token> tokens,
    Identifier label,
    String kind,  // "for" | "if" | "case"
    Identifier parameter,
    DiscreteRange range,
    Expression selector,
    GenerateBody body,
    List<GenerateBranch> branches,
    Identifier endLabel
) implements ConcurrentStatement {
    @Override
    public String type() {
        return "GenerateStatement";
    }
}
