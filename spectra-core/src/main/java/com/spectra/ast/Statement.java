package com.spectra.ast;

public sealed interface Statement extends Node permits
    ExpressionStatement,
    ReturnStatement,
    BreakStatement,
    ContinueStatement,
    VarStatement,
    BlockStatement,
    IfStatement,
    WhileStatement {
}
