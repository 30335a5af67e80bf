package com.hdltree.ast;

import com.hdltree.Span;
import com.hdltree.Token;

import java.util.List;

public record PackageInstantiation(
    Span span,
    List<Token> tokens,
    Identifier name,
    Name uninstantiated,
    GenericMapAspect genericMap
) implements LibraryUnit, Declaration {
    @Override
    public String type() {
        return "PackageInstantiation";
    }
}
