package com.hdltree.ast;

import com.hdltree.Span;
import com.hdltree.Token;

import java.util.List;

public record BlockConfiguration(
    Span span,
    List<Token> tokens,
    Name specification,
    List<UseClause> useClauses,
    List<Node> items
) implements Node {
    @Override
    public String type() {
        return "BlockConfiguration";
    }
}
