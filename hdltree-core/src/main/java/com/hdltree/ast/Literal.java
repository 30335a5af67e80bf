package com.hdltree.ast;

import com.hdltree.Span;
import com.hdltree.Token;

import java.util.List;

public record Literal(
    Span span,
    List<Token> tokens,
    String kind,  // "decimal" | "based" | "physical" | "character" | "string" | "bit_string" | "null"
    String text,
    String unit
) implements Expression {
    @Override
    public String type() {
        return "Literal";
    }
}
