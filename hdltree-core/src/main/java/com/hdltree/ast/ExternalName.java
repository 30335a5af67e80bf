package com.hdltree.ast;

import com.hdltree.Span;
import com.hdltree.Token;

import java.util.List;

public record ExternalName(
    Span span,
    List<Token> tokens,
    String objectClass,
    String path,
    List<Expression> pathIndexes,
    SubtypeIndication subtype
) implements Name {
    @Override
    public String type() {
        return "ExternalName";
    }
}
