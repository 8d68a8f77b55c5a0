package org.csu.crusty.compiler.parser.ast.statement;

import org.csu.crusty.common.model.Span;
import org.csu.crusty.compiler.parser.ast.ExpressionNode;
import org.csu.crusty.compiler.parser.ast.StatementNode;
import org.csu.crusty.compiler.parser.ast.TypeNode;

/**
 * AST 节点: var 声明 (可变绑定)
 */
public record VarStatementNode(String name, TypeNode type, ExpressionNode init, Span span) implements StatementNode {

    public VarStatementNode(String name, TypeNode type, ExpressionNode init) {
        this(name, type, init, Span.UNKNOWN);
    }
}
