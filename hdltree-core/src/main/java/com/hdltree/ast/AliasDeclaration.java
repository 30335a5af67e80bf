package com.hdltree.ast;

import com.hdltree.Span;
import com.hdltree.Token;

import java.util.List;

public record AliasDeclaration(
    Span span,
    List<Token> tokens,
    Identifier designator,
    SubtypeIndication subtype,
    Name target,
    Signature signature
) implements Declaration {
    @Override
    public String type() {
        return "AliasDeclaration";
    }
}
