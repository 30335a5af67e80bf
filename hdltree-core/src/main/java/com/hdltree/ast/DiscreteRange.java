package com.hdltree.ast;

/**
 * A range written explicitly, by attribute, or as a subtype indication.
 */
public sealed interface DiscreteRange extends Node permits
    SubtypeIndication,
    AttributeName,
    RangeExpression {
}
