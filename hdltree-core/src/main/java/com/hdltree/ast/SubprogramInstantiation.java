package com.hdltree.ast;

import com.hdltree.Span;
import com.hdltree.Token;

import java.util.List;

public record SubprogramInstantiation(
    Span span,
    List<Token> tokens,
    String kind,
    Identifier designator,
    Name uninstantiated,
    Signature signature,
    GenericMapAspect genericMap
) implements Declaration {
    @Override
    public String type() {
        return "SubprogramInstantiation";
    }
}
