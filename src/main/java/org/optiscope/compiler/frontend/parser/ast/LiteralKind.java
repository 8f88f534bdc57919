package org.optiscope.compiler.frontend.parser.ast;

public enum LiteralKind {
    NUMBER,
    BOOLEAN,
    STRING
}
