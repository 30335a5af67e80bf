package com.hdltree.ast;

import com.hdltree.Span;
import com.hdltree.Token;

import java.util.List;

public record InterfaceType(
    Span span,
    List<Token> tokens,
    Identifier name
) implements InterfaceElement {
    @Override
    public String type() {
        return "InterfaceType";
    }
}
