package com.hdltree.ast;

import com.hdltree.Span;
import com.hdltree.Token;

import java.util.List;

public record LoopStatement(
    Span span,
    List<Token> tokens,
    Identifier label,
    String kind,  // "loop" | "while" | "for"
    Expression condition,
    Identifier parameter,
    DiscreteRange range,
    List<SequentialStatement> statements,
    Identifier endLabel
) implements SequentialStatement {
    @Override
    public String type() {
        return "LoopStatement";
    }
}
