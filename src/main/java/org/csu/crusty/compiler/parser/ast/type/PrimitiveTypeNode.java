package org.csu.crusty.compiler.parser.ast.type;

import org.csu.crusty.compiler.parser.ast.TypeNode;

public record PrimitiveTypeNode(PrimitiveKind kind) implements TypeNode {

    public static PrimitiveTypeNode of(PrimitiveKind kind) {
        return new PrimitiveTypeNode(kind);
    }

    public boolean isVoid() {
        return kind == PrimitiveKind.VOID;
    }
}
