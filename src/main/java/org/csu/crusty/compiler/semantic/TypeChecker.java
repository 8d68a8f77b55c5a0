package org.csu.crusty.compiler.semantic;

import org.csu.crusty.compiler.parser.ast.ExpressionNode;
import org.csu.crusty.compiler.parser.ast.TypeNode;
import org.csu.crusty.compiler.parser.ast.expression.*;
import org.csu.crusty.compiler.parser.ast.type.*;

import java.util.EnumSet;
import java.util.Set;
import java.util.function.Function;

/**
 * @author hidyouth
 * @description: 最小化的类型推断, 只用于检查 return 表达式与声明的返回类型是否一致.
 * 推断不出的类型返回 null, null 与任何类型都兼容
 */
public class TypeChecker {

    /**
     * 无后缀的数字字面量. 整数字面量可作任意整数类型, 浮点字面量可作任意浮点类型
     */
    public record LiteralType(boolean floating) implements TypeNode {
    }

    private static final Set<PrimitiveKind> INTEGER_KINDS =
            EnumSet.of(PrimitiveKind.INT, PrimitiveKind.I32, PrimitiveKind.I64, PrimitiveKind.U32, PrimitiveKind.U64);
    private static final Set<PrimitiveKind> FLOAT_KINDS =
            EnumSet.of(PrimitiveKind.FLOAT, PrimitiveKind.F32, PrimitiveKind.F64);

    private final Function<String, Binding> resolver;

    public TypeChecker(Function<String, Binding> resolver) {
        this.resolver = resolver;
    }

    public TypeNode infer(ExpressionNode expression) {
        if (expression instanceof LiteralNode literal) {
            return switch (literal.kind()) {
                case INT -> new LiteralType(false);
                case FLOAT -> new LiteralType(true);
                case BOOL -> PrimitiveTypeNode.of(PrimitiveKind.BOOL);
                case CHAR -> PrimitiveTypeNode.of(PrimitiveKind.CHAR);
                default -> null;
            };
        }
        if (expression instanceof IdentifierNode identifier) {
            Binding binding = resolver.apply(identifier.name());
            if (binding == null || binding.mutability() == Binding.Mutability.FUNCTION) {
                return null;
            }
            return binding.type();
        }
        if (expression instanceof BinaryExpressionNode binary) {
            if (binary.operator().isComparison() || binary.operator().isLogical()) {
                return PrimitiveTypeNode.of(PrimitiveKind.BOOL);
            }
            if (binary.operator().isAssignment()) {
                return null;
            }
            return preferTyped(infer(binary.left()), infer(binary.right()));
        }
        if (expression instanceof UnaryExpressionNode unary) {
            return switch (unary.operator()) {
                case NOT -> PrimitiveTypeNode.of(PrimitiveKind.BOOL);
                case NEG, BIT_NOT, PRE_INC, PRE_DEC, POST_INC, POST_DEC -> infer(unary.operand());
                default -> null;
            };
        }
        if (expression instanceof CastExpressionNode cast) {
            return cast.type();
        }
        if (expression instanceof TernaryExpressionNode ternary) {
            return preferTyped(infer(ternary.thenExpression()), infer(ternary.elseExpression()));
        }
        if (expression instanceof CallExpressionNode call && call.callee() instanceof IdentifierNode callee) {
            Binding binding = resolver.apply(callee.name());
            if (binding != null && binding.mutability() == Binding.Mutability.FUNCTION) {
                return binding.type();
            }
        }
        return null;
    }

    /**
     * 只比较基本类型; int 与 i32, float 与 f64 视为同一类型
     */
    public boolean isCompatible(TypeNode declared, TypeNode actual) {
        if (declared instanceof PrimitiveTypeNode d && actual instanceof LiteralType literal) {
            return (literal.floating() ? FLOAT_KINDS : INTEGER_KINDS).contains(d.kind());
        }
        if (declared instanceof PrimitiveTypeNode d && actual instanceof PrimitiveTypeNode a) {
            return normalize(d.kind()) == normalize(a.kind());
        }
        return true;
    }

    public static String describe(TypeNode type) {
        if (type == null) {
            return "void";
        }
        if (type instanceof PrimitiveTypeNode primitive) {
            return primitive.kind().crustyName();
        }
        if (type instanceof LiteralType literal) {
            return literal.floating() ? "float literal" : "integer literal";
        }
        if (type instanceof NamedTypeNode named) {
            return named.name();
        }
        return type.getClass().getSimpleName().replace("TypeNode", "").toLowerCase();
    }

    // 字面量的类型由另一侧决定, 如 1 + a 取 a 的类型
    private static TypeNode preferTyped(TypeNode first, TypeNode second) {
        if (first == null || (first instanceof LiteralType && second != null && !(second instanceof LiteralType))) {
            return second;
        }
        if (first instanceof LiteralType a && second instanceof LiteralType b) {
            return new LiteralType(a.floating() || b.floating());
        }
        return first;
    }

    private static PrimitiveKind normalize(PrimitiveKind kind) {
        return switch (kind) {
            case INT -> PrimitiveKind.I32;
            case FLOAT -> PrimitiveKind.F64;
            default -> kind;
        };
    }
}
