package com.hdltree.ast;

import com.hdltree.Span;
import com.hdltree.Token;

import java.util.List;

public record IfStatement(
    Span span,
    List<Token> tokens,
    Identifier label,
    List<IfBranch> branches,
    Identifier endLabel
) implements SequentialStatement {
    @Override
    public String type() {
        return "IfStatement";
    }
}
