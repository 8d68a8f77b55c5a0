package org.csu.crusty.compiler.parser.ast.item;

import org.csu.crusty.common.model.Span;
import org.csu.crusty.compiler.lexer.Token;
import org.csu.crusty.compiler.parser.ast.ItemNode;
import org.csu.crusty.compiler.parser.ast.MacroDelimiter;

import java.util.List;

/**
 * AST 节点: #define __NAME__(a, b) body
 * 宏体保存为原始Token序列, 不做解析
 */
public record MacroDefinitionNode(
        String name,
        List<String> params,
        MacroDelimiter delimiter,
        List<Token> body,
        Span span
) implements ItemNode {
}
