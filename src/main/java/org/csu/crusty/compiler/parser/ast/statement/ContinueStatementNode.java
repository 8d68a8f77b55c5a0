package org.csu.crusty.compiler.parser.ast.statement;

import org.csu.crusty.common.model.Span;
import org.csu.crusty.compiler.parser.ast.StatementNode;

public record ContinueStatementNode(String label, Span span) implements StatementNode {

    public ContinueStatementNode(String label) {
        this(label, Span.UNKNOWN);
    }
}
