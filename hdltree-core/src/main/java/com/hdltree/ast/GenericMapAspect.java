package com.hdltree.ast;

import com.hdltree.Span;
import com.hdltree.Token;

import java.util.List;

public record GenericMapAspect(
    Span span,
    List<Token> tokens,
    List<AssociationElement> associations
) implements Node {
    @Override
    public String type() {
        return "GenericMapAspect";
    }
}
