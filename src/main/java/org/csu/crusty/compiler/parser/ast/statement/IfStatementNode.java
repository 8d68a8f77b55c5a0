package org.csu.crusty.compiler.parser.ast.statement;

import org.csu.crusty.compiler.parser.ast.ExpressionNode;
import org.csu.crusty.compiler.parser.ast.StatementNode;

/**
 * else if 链表示为 elseBlock 中只含一个 IfStatementNode
 */
public record IfStatementNode(ExpressionNode condition, BlockNode thenBlock, BlockNode elseBlock) implements StatementNode {
}
