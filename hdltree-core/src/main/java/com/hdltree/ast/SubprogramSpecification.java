package com.hdltree.ast;

import com.hdltree.Span;
import com.hdltree.Token;

import java.util.List;

public record SubprogramSpecification(
    Span span,
    List<Token> tokens,
    String kind,  // "procedure" | "function"
    String purity,  // "pure" | "impure" or null
    Identifier designator,
    SubprogramHeader header,
    List<InterfaceElement> parameters,
    Name returnType
) implements Node {
    @Override
    public String type() {
        return "SubprogramSpecification";
    }
}
