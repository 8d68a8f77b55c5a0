package org.csu.crusty.compiler.parser.ast.statement;

import org.csu.crusty.compiler.parser.ast.ExpressionNode;
import org.csu.crusty.compiler.parser.ast.StatementNode;

/**
 * 表达式语句, 赋值 (x = 1;) 也属于这一类
 */
public record ExpressionStatementNode(ExpressionNode expression) implements StatementNode {
}
