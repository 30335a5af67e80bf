package com.hdltree.ast;

import com.hdltree.Span;
import com.hdltree.Token;

import java.util.List;

public record CaseAlternative(
    Span span,
    List<Token> tokens,
    List<Expression> choices,
    List<SequentialStatement> statements
) implements Node {
    @Override
    public String type() {
        return "CaseAlternative";
    }
}
