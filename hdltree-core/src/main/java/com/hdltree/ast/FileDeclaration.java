package com.hdltree.ast;

import com.hdltree.Span;
import com.hdltree.Token;

import java.util.List;

public record FileDeclaration(
    Span span,
    List<Token> tokens,
    List<Identifier> names,
    SubtypeIndication subtype,
    Expression openKind,
    Expression logicalName
) implements Declaration {
    @Override
    public String type() {
        return "FileDeclaration";
    }
}
