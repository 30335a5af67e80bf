package com.hdltree.ast;

public sealed interface SequentialStatement extends Node permits
    SignalAssignment,
    AssertionStatement,
    ProcedureCall,
    WaitStatement,
    ReportStatement,
    VariableAssignment,
    IfStatement,
    CaseStatement,
    LoopStatement,
    NextStatement,
    ExitStatement,
    ReturnStatement,
    NullStatement {
}
