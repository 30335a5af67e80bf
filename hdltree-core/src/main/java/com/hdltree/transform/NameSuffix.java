package com.hdltree.transform;

import com.hdltree.Span;
import com.hdltree.Token;
import com.hdltree.ast.DiscreteRange;
import com.hdltree.ast.Expression;

import java.util.List;

/**
 * A suffix of a name, held until the enclosing name folds it onto its prefix.
 */
record NameSuffix(
    String kind,  // "selected" | "index" | "slice" | "attribute"
    Span span,
    List<Token> tokens,
    String designator,
    List<Expression> indexes,
    DiscreteRange range
) {
}
