package com.hdltree.ast;

import com.hdltree.Span;
import com.hdltree.Token;

import java.util.List;

public record SelectedName(
    Span span,
    List<Token> tokens,
    Name prefix,
    String suffix
) implements Name {
    @Override
    public String type() {
        return "SelectedName";
    }
}
