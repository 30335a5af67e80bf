package com.hdltree.ast;

public sealed interface Constraint extends Node permits
    RangeConstraint,
    IndexConstraint {
}
