package com.hdltree.ast;

import com.hdltree.Span;
import com.hdltree.Token;

import java.util.List;

public record ArrayTypeDefinition(
    Span span,
    List<Token> tokens,
    List<Node> indexes,  // UnboundedRange or DiscreteRange
    SubtypeIndication elementType
) implements TypeDefinition {
    @Override
    public String type() {
        return "ArrayTypeDefinition";
    }
}
