package org.csu.crusty.compiler.parser.ast.statement;

import org.csu.crusty.compiler.parser.ast.ExpressionNode;
import org.csu.crusty.compiler.parser.ast.StatementNode;

import java.util.List;

/**
 * defaultBlock 为 null 表示没有 default 分支
 */
public record SwitchStatementNode(ExpressionNode subject, List<SwitchCaseNode> cases, BlockNode defaultBlock) implements StatementNode {
}
