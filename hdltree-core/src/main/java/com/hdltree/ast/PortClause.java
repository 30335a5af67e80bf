package com.hdltree.ast;

import com.hdltree.Span;
import com.hdltree.Token;

import java.util.List;

public record PortClause(
    Span span,
    List<Token> tokens,
    List<InterfaceElement> elements
) implements Node {
    @Override
    public String type() {
        return "PortClause";
    }
}
