package org.csu.crusty.compiler.parser.ast;

public enum Visibility {
    PUBLIC,
    PRIVATE
}
