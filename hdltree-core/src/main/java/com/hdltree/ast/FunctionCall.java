package com.hdltree.ast;

import com.hdltree.Span;
import com.hdltree.Token;

import java.util.List;

public record FunctionCall(
    Span span,
    List<Token> tokens,
    Name function,
    List<AssociationElement> arguments
) implements Expression {
    @Override
    public String type() {
        return "FunctionCall";
    }
}
