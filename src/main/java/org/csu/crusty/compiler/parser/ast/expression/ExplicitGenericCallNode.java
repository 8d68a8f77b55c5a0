package org.csu.crusty.compiler.parser.ast.expression;

import org.csu.crusty.common.model.Span;
import org.csu.crusty.compiler.parser.ast.ExpressionNode;
import org.csu.crusty.compiler.parser.ast.TypeNode;

import java.util.List;

/**
 * AST 节点: @Type(T).method(args), 对应 Rust 的 Type::&lt;T&gt;::method(args)
 */
public record ExplicitGenericCallNode(
        TypeNode type,
        List<TypeNode> generics,
        String method,
        List<ExpressionNode> arguments,
        Span span
) implements ExpressionNode {

    public ExplicitGenericCallNode(TypeNode type, List<TypeNode> generics, String method, List<ExpressionNode> arguments) {
        this(type, generics, method, arguments, Span.UNKNOWN);
    }
}
