package com.hdltree.ast;

import com.hdltree.Span;
import com.hdltree.Token;

import java.util.List;

/**
 * Also the reading chosen for {@code f(x)} when nothing says whether {@code f} is a function.
 */
public record IndexedName(
    Span span,
    List<Token> tokens,
    Name prefix,
    List<Expression> indexes
) implements Name {
    @Override
    public String type() {
        return "IndexedName";
    }
}
