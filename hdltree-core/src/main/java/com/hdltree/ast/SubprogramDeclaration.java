package com.hdltree.ast;

import com.hdltree.Span;
import com.hdltree.Token;

import java.util.List;

public record SubprogramDeclaration(
    Span span,
    List<Token> tokens,
    SubprogramSpecification specification
) implements Declaration {
    @Override
    public String type() {
        return "SubprogramDeclaration";
    }
}
