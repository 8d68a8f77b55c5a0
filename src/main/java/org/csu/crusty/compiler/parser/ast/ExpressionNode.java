package org.csu.crusty.compiler.parser.ast;

public interface ExpressionNode extends AstNode {
}
