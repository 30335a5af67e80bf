package com.hdltree.ast;

import com.hdltree.Span;
import com.hdltree.Token;

import java.util.List;

public record NullStatement(
    Span span,
    List<Token> tokens,
    Identifier label
) implements SequentialStatement {
    @Override
    public String type() {
        return "NullStatement";
    }
}
