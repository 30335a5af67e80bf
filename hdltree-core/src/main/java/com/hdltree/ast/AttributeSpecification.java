package com.hdltree.ast;

import com.hdltree.Span;
import com.hdltree.Token;

import java.util.List;

public record AttributeSpecification(
    Span span,
    List<Token> tokens,
    Identifier attribute,
    List<Identifier> entities,
    List<Signature> signatures,
    String selector,  // "all", "others" or null
    String entityClass,
    Expression value
) implements Declaration {
    @Override
    public String type() {
        return "AttributeSpecification";
    }
}
