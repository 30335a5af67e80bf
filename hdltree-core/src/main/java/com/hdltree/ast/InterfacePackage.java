package com.hdltree.ast;

import com.hdltree.Span;
import com.hdltree.Token;

import java.util.List;

public record InterfacePackage(
    Span span,
    List<Token> tokens,
    Identifier name,
    Name uninstantiated,
    String mapKind,  // "box" | "default" | "associations"
    List<AssociationElement> associations
) implements InterfaceElement {
    @Override
    public String type() {
        return "InterfacePackage";
    }
}
