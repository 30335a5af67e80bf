package com.hdltree.ast;

import com.hdltree.Span;
import com.hdltree.Token;

import java.util.List;

public record NextStatement(
    Span span,
    List<Token> tokens,
    Identifier label,
    Identifier loopLabel,
    Expression condition
) implements SequentialStatement {
    @Override
    public String type() {
        return "NextStatement";
    }
}
