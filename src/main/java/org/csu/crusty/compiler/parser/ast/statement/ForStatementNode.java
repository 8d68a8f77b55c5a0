package org.csu.crusty.compiler.parser.ast.statement;

import org.csu.crusty.compiler.parser.ast.ExpressionNode;
import org.csu.crusty.compiler.parser.ast.StatementNode;

/**
 * C 风格三段式 for 循环
 */
public record ForStatementNode(
        String label,
        StatementNode init,
        ExpressionNode condition,
        ExpressionNode increment,
        BlockNode body
) implements StatementNode {
}
