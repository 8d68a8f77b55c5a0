package org.csu.crusty.compiler.parser.ast;

/**
 * 类型节点. 与 ExpressionNode 分开, 解析括号时先尝试类型再回退为表达式
 */
public interface TypeNode extends AstNode {
}
