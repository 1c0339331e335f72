package com.spectra.ast;

public sealed interface Expression extends Node permits
    Literal,
    BinaryExpression,
    PostfixExpression,
    PrefixExpression,
    Identifier,
    CallExpression,
    FieldAccessExpression,
    FunctionExpression {
}
