package com.hdltree.ast;

import com.hdltree.Span;
import com.hdltree.Token;

import java.util.List;

public record SliceName(
    Span span,
    List<Token> tokens,
    Name prefix,
    DiscreteRange range
) implements Name {
    @Override
    public String type() {
        return "SliceName";
    }
}
