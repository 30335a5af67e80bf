package com.hdltree.ast;

import com.hdltree.Span;
import com.hdltree.Token;

import java.util.List;

public record ConfigurationSpecification(
    Span span,
    List<Token> tokens,
    List<Identifier> instances,
    String selector,  // "all", "others" or null
    Name component,
    BindingIndication binding
) implements Declaration {
    @Override
    public String type() {
        return "ConfigurationSpecification";
    }
}
