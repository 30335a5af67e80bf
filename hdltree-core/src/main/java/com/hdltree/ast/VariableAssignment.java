package com.hdltree.ast;

import com.hdltree.Span;
import com.hdltree.Token;

import java.util.List;

public record VariableAssignment(
    Span span,
    List<Token> tokens,
    Identifier label,
    Expression target,
    List<Node> values  // Expression or ConditionalValue
) implements SequentialStatement {
    @Override
    public String type() {
        return "VariableAssignment";
    }
}
