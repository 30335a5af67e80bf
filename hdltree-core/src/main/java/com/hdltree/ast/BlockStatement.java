package com.hdltree.ast;

import com.hdltree.Span;
import com.hdltree.Token;

import java.util.List;

public record BlockStatement(
    Span span,
    List<Token> tokens,
    Identifier label,
    Expression guard,
    GenericClause generics,
    GenericMapAspect genericMap,
    PortClause ports,
    PortMapAspect portMap,
    List<Declaration> declarations,
    List<ConcurrentStatement> statements,
    Identifier endLabel
) implements ConcurrentStatement {
    @Override
    public String type() {
        return "BlockStatement";
    }
}
