package com.hdltree.ast;

import com.hdltree.Span;
import com.hdltree.Token;

import java.util.List;

public record AssociationElement(
    Span span,
    List<Token> tokens,
    Name formal,
    Expression actual,  // null when open
    boolean open,
    boolean inertial
) implements Node {
    @Override
    public String type() {
        return "AssociationElement";
    }
}
