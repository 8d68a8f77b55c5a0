package org.csu.crusty.compiler.parser.ast.statement;

import org.csu.crusty.common.model.Span;
import org.csu.crusty.compiler.parser.ast.ExpressionNode;
import org.csu.crusty.compiler.parser.ast.StatementNode;

/**
 * for (x in 0..10) { ... }
 */
public record ForInStatementNode(
        String label,
        String variable,
        ExpressionNode iterable,
        BlockNode body,
        Span span
) implements StatementNode {
}
