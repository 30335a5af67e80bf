package com.hdltree.ast;

import com.hdltree.Span;
import com.hdltree.Token;

import java.util.List;

public record InterfaceObject(
    Span span,
    List<Token> tokens,
    String objectClass,  // "constant" | "signal" | "variable" | "file" or null
    List<Identifier> names,
    String mode,  // "in" | "out" | "inout" | "buffer" | "linkage" or null
    SubtypeIndication subtype,
    boolean bus,
    Expression defaultValue
) implements InterfaceElement {
    @Override
    public String type() {
        return "InterfaceObject";
    }
}
