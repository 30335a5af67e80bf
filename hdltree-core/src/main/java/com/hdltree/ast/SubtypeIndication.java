package com.hdltree.ast;

import com.hdltree.Span;
import com.hdltree.Token;

import java.util.List;

/**
 * @param resolution         resolution function, or null
 * @param elementResolution  true when the function resolves the array elements, as in
 *                           {@code (resolved) std_ulogic_vector}
 */
public record SubtypeIndication(
    Span span,
    List<Token> tokens,
    Name resolution,
    boolean elementResolution,
    Name typeMark,
    List<Constraint> constraints
) implements DiscreteRange {
    @Override
    public String type() {
        return "SubtypeIndication";
    }
}
