package com.hdltree.ast;

import com.hdltree.Span;
import com.hdltree.Token;

import java.util.List;

public record DelayMechanism(
    Span span,
    List<Token> tokens,
    String kind,  // "transport" | "inertial"
    Expression rejectTime
) implements Node {
    @Override
    public String type() {
        return "DelayMechanism";
    }
}
