package com.hdltree.ast;

import com.hdltree.Span;
import com.hdltree.Token;

import java.util.List;

public record PhysicalTypeDefinition(
    Span span,
    List<Token> tokens,
    DiscreteRange range,
    Identifier primaryUnit,
    List<SecondaryUnit> secondaryUnits,
    Identifier endName
) implements TypeDefinition {
    @Override
    public String type() {
        return "PhysicalTypeDefinition";
    }
}
