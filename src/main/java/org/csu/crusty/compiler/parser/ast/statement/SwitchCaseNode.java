package org.csu.crusty.compiler.parser.ast.statement;

import org.csu.crusty.compiler.parser.ast.AstNode;
import org.csu.crusty.compiler.parser.ast.ExpressionNode;

import java.util.List;

/**
 * case 1, 2: { ... }  多个值共享一个分支
 */
public record SwitchCaseNode(List<ExpressionNode> values, BlockNode body) implements AstNode {
}
