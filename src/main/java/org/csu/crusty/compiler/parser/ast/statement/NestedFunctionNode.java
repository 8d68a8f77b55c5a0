package org.csu.crusty.compiler.parser.ast.statement;

import org.csu.crusty.common.model.Span;
import org.csu.crusty.compiler.parser.ast.Parameter;
import org.csu.crusty.compiler.parser.ast.StatementNode;
import org.csu.crusty.compiler.parser.ast.TypeNode;

import java.util.List;

/**
 * AST 节点: 定义在函数体内部的函数, 生成 Rust 时变为闭包.
 * 捕获信息以节点的对象身份为键另行保存, 见 AnalysisResult
 */
public record NestedFunctionNode(
        String name,
        List<Parameter> params,
        TypeNode returnType,
        BlockNode body,
        Span span
) implements StatementNode {

    public NestedFunctionNode(String name, List<Parameter> params, TypeNode returnType, BlockNode body) {
        this(name, params, returnType, body, Span.UNKNOWN);
    }
}
