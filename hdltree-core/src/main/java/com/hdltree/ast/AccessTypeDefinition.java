package com.hdltree.ast;

import com.hdltree.Span;
import com.hdltree.Token;

import java.util.List;

public record AccessTypeDefinition(
    Span span,
    List<Token> tokens,
    SubtypeIndication designated
) implements TypeDefinition {
    @Override
    public String type() {
        return "AccessTypeDefinition";
    }
}
