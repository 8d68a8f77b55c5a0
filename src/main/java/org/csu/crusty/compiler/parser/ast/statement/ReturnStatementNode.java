package org.csu.crusty.compiler.parser.ast.statement;

import org.csu.crusty.common.model.Span;
import org.csu.crusty.compiler.parser.ast.ExpressionNode;
import org.csu.crusty.compiler.parser.ast.StatementNode;

public record ReturnStatementNode(ExpressionNode value, Span span) implements StatementNode {

    public ReturnStatementNode(ExpressionNode value) {
        this(value, Span.UNKNOWN);
    }
}
