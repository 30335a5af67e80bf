package com.hdltree.ast;

import com.hdltree.Span;
import com.hdltree.Token;

import java.util.List;

public record SubprogramHeader(
    Span span,
    List<Token> tokens,
    List<InterfaceElement> generics,
    GenericMapAspect genericMap
) implements Node {
    @Override
    public String type() {
        return "SubprogramHeader";
    }
}
