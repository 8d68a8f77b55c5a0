package org.csu.crusty.compiler.parser.ast.statement;

import org.csu.crusty.compiler.parser.ast.StatementNode;

import java.util.List;

/**
 * 花括号包围的语句块, 也可以单独作为一条语句出现
 */
public record BlockNode(List<StatementNode> statements) implements StatementNode {

    public static BlockNode of(StatementNode... statements) {
        return new BlockNode(List.of(statements));
    }
}
