package org.csu.crusty.compiler.parser.ast.statement;

import org.csu.crusty.compiler.parser.ast.ExpressionNode;
import org.csu.crusty.compiler.parser.ast.StatementNode;

/**
 * label 可以为 null; loop {} 解析为条件恒为 true 的 while
 */
public record WhileStatementNode(String label, ExpressionNode condition, BlockNode body) implements StatementNode {
}
