package com.hdltree.ast;

import com.hdltree.Span;
import com.hdltree.Token;

import java.util.List;

public record UnboundedRange(
    Span span,
    List<Token> tokens,
    Name typeMark
) implements Node {
    @Override
    public String type() {
        return "UnboundedRange";
    }
}
