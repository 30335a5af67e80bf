package com.hdltree.ast;

import com.hdltree.Span;
import com.hdltree.Token;

import java.util.List;

public record EntityAspect(
    Span span,
    List<Token> tokens,
    String kind,  // "entity" | "configuration" | "open"
    Name unit,
    Identifier architecture
) implements Node {
    @Override
    public String type() {
        return "EntityAspect";
    }
}
