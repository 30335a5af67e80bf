package com.hdltree.ast;

import com.hdltree.Span;
import com.hdltree.Token;

import java.util.List;

public record WaveformElement(
    Span span,
    List<Token> tokens,
    Expression value,
    Expression after
) implements Node {
    @Override
    public String type() {
        return "WaveformElement";
    }
}
