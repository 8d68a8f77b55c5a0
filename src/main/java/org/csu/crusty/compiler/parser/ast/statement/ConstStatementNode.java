package org.csu.crusty.compiler.parser.ast.statement;

import org.csu.crusty.common.model.Span;
import org.csu.crusty.compiler.parser.ast.ExpressionNode;
import org.csu.crusty.compiler.parser.ast.StatementNode;
import org.csu.crusty.compiler.parser.ast.TypeNode;

public record ConstStatementNode(String name, TypeNode type, ExpressionNode value, Span span) implements StatementNode {

    public ConstStatementNode(String name, TypeNode type, ExpressionNode value) {
        this(name, type, value, Span.UNKNOWN);
    }
}
