package com.hdltree.ast;

import com.hdltree.Span;
import com.hdltree.Token;

import java.util.List;

public record FileTypeDefinition(
    Span span,
    List<Token> tokens,
    Name typeMark
) implements TypeDefinition {
    @Override
    public String type() {
        return "FileTypeDefinition";
    }
}
