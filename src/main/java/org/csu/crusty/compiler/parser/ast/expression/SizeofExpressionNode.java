package org.csu.crusty.compiler.parser.ast.expression;

import org.csu.crusty.compiler.parser.ast.ExpressionNode;
import org.csu.crusty.compiler.parser.ast.TypeNode;

public record SizeofExpressionNode(TypeNode type) implements ExpressionNode {
}
