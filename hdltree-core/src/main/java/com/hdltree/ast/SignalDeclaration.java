package com.hdltree.ast;

import com.hdltree.Span;
import com.hdltree.Token;

import java.util.List;

public record SignalDeclaration(
    Span span,
    List<Token> tokens,
    List<Identifier> names,
    SubtypeIndication subtype,
    String signalKind,  // "register" | "bus" or null
    Expression value
) implements Declaration {
    @Override
    public String type() {
        return "SignalDeclaration";
    }
}
