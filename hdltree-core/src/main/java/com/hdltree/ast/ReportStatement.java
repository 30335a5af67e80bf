package com.hdltree.ast;

import com.hdltree.Span;
import com.hdltree.Token;

import java.util.List;

public record ReportStatement(
    Span span,
    List<Token> tokens,
    Identifier label,
    Expression report,
    Expression severity
) implements SequentialStatement {
    @Override
    public String type() {
        return "ReportStatement";
    }
}
