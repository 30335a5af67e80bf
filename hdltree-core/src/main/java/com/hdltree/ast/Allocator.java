package com.hdltree.ast;

import com.hdltree.Span;
import com.hdltree.Token;

import java.util.List;

public record Allocator(
    Span span,
    List<Token> tokens,
    Node operand  // SubtypeIndication or QualifiedExpression
) implements Expression {
    @Override
    public String type() {
        return "Allocator";
    }
}
