package com.hdltree.ast;

import com.hdltree.Span;
import com.hdltree.Token;

import java.util.List;

public record ComponentInstantiation(
    Span span,
    List<Token> tokens,
    Identifier label,
    String unitKind,  // "component" | "entity" | "configuration"
    Name unit,
    Identifier architecture,
    GenericMapAspect genericMap,
    PortMapAspect portMap
) implements ConcurrentStatement {
    @Override
    public String type() {
        return "ComponentInstantiation";
    }
}
