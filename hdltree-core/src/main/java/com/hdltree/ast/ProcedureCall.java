package com.hdltree.ast;

import com.hdltree.Span;
import com.hdltree.Token;

import java.util.List;

public record ProcedureCall(
    Span span,
    List<Token> tokens,
    Identifier label,
    boolean postponed,
    Name procedure,
    List<AssociationElement> arguments
) implements ConcurrentStatement, SequentialStatement {
    @Override
    public String type() {
        return "ProcedureCall";
    }
}
