package org.csu.crusty.compiler.parser.ast.type;

import org.csu.crusty.compiler.parser.ast.TypeNode;

/**
 * 交给下游推断的类型 (auto / 省略)
 */
public record AutoTypeNode() implements TypeNode {
}
