package com.hdltree.ast;

public sealed interface ConcurrentStatement extends Node permits
    ProcessStatement,
    BlockStatement,
    SignalAssignment,
    AssertionStatement,
    ProcedureCall,
    ComponentInstantiation,
    GenerateStatement {
}
