package com.hdltree.ast;

public sealed interface Expression extends Node permits
    Name,
    FunctionCall,
    Literal,
    BinaryExpression,
    UnaryExpression,
    Aggregate,
    QualifiedExpression,
    Allocator,
    ParenthesizedExpression,
    RangeExpression,
    Others {
}
