package org.csu.crusty.compiler.parser.ast;

public interface StatementNode extends AstNode {
}
