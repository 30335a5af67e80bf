package com.hdltree.ast;

import com.hdltree.Span;
import com.hdltree.Token;

import java.util.List;

public record CaseStatement(
    Span span,
    List<Token> tokens,
    Identifier label,
    boolean matching,
    Expression selector,
    List<CaseAlternative> alternatives,
    Identifier endLabel
) implements SequentialStatement {
    @Override
    public String type() {
        return "CaseStatement";
    }
}
