package com.hdltree.ast;

import com.hdltree.Span;
import com.hdltree.Token;

import java.util.List;

public record ComponentConfiguration(
    Span span,
    List<Token> tokens,
    List<Identifier> instances,
    String selector,  // "all", "others" or null
    Name component,
    BindingIndication binding,
    BlockConfiguration block
) implements Node {
    @Override
    public String type() {
        return "ComponentConfiguration";
    }
}
