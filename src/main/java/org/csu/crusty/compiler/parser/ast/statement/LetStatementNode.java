package org.csu.crusty.compiler.parser.ast.statement;

import org.csu.crusty.common.model.Span;
import org.csu.crusty.compiler.parser.ast.ExpressionNode;
import org.csu.crusty.compiler.parser.ast.StatementNode;
import org.csu.crusty.compiler.parser.ast.TypeNode;

/**
 * AST 节点: let 声明, 以及省略关键字的隐式声明 (int x = 1;)
 * type 和 init 可以为 null
 */
public record LetStatementNode(
        String name,
        TypeNode type,
        ExpressionNode init,
        boolean mutable,
        Span span
) implements StatementNode {

    public LetStatementNode(String name, TypeNode type, ExpressionNode init, boolean mutable) {
        this(name, type, init, mutable, Span.UNKNOWN);
    }
}
