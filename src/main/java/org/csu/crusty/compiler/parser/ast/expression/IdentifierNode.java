package org.csu.crusty.compiler.parser.ast.expression;

import org.csu.crusty.common.model.Span;
import org.csu.crusty.compiler.parser.ast.ExpressionNode;

public record IdentifierNode(String name, Span span) implements ExpressionNode {

    public IdentifierNode(String name) {
        this(name, Span.UNKNOWN);
    }
}
