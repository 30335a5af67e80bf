package com.hdltree.ast;

import com.hdltree.Span;
import com.hdltree.Token;

import java.util.List;

public record BindingIndication(
    Span span,
    List<Token> tokens,
    EntityAspect entityAspect,
    GenericMapAspect genericMap,
    PortMapAspect portMap
) implements Node {
    @Override
    public String type() {
        return "BindingIndication";
    }
}
