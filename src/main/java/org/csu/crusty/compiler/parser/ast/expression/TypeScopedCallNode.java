package org.csu.crusty.compiler.parser.ast.expression;

import org.csu.crusty.common.model.Span;
import org.csu.crusty.compiler.parser.ast.ExpressionNode;
import org.csu.crusty.compiler.parser.ast.TypeNode;

import java.util.List;

/**
 * AST 节点: @Type.method(args), 对应 Rust 的 Type::method(args)
 */
public record TypeScopedCallNode(TypeNode type, String method, List<ExpressionNode> arguments, Span span) implements ExpressionNode {

    public TypeScopedCallNode(TypeNode type, String method, List<ExpressionNode> arguments) {
        this(type, method, arguments, Span.UNKNOWN);
    }
}
