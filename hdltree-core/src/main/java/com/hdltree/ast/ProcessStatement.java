package com.hdltree.ast;

import com.hdltree.Span;
import com.hdltree.Token;

import java.util.List;

public record ProcessStatement(
    Span span,
    List<Token> tokens,
    Identifier label,
    boolean postponed,
    boolean sensitiveToAll,
    List<Name> sensitivity,
    List<Declaration> declarations,
    List<SequentialStatement> statements,
    Identifier endLabel
) implements ConcurrentStatement {
    @Override
    public String type() {
        return "ProcessStatement";
    }
}
