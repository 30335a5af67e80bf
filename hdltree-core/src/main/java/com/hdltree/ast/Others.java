package com.hdltree.ast;

import com.hdltree.Span;
import com.hdltree.Token;

import java.util.List;

public record Others(
    Span span,
    List<Token> tokens
) implements Expression {
    @Override
    public String type() {
        return "Others";
    }
}
