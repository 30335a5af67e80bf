package com.hdltree.ast;

import com.hdltree.Span;
import com.hdltree.Token;

import java.util.List;

public record IfBranch(
    Span span,
    List<Token> tokens,
    Expression condition,  // null for else
    List<SequentialStatement> statements
) implements Node {
    @Override
    public String type() {
        return "IfBranch";
    }
}
