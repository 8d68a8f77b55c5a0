package org.csu.crusty.compiler.semantic;

import org.csu.crusty.compiler.parser.ast.AstNode;
import org.csu.crusty.compiler.parser.ast.statement.NestedFunctionNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * @author hidyouth
 * @description: 捕获分析的结果, 交给代码生成器使用.
 * 所有表都以AST节点的对象身份为键, 两个结构相同的嵌套函数互不影响
 */
public class AnalysisResult {

    private final Map<NestedFunctionNode, List<CaptureRecord>> captures = new IdentityHashMap<>();
    private final List<NestedFunctionNode> nestedFunctions = new ArrayList<>();
    private final Set<AstNode> mutableDeclarations = Collections.newSetFromMap(new IdentityHashMap<>());
    private final List<SemanticError> errors = new ArrayList<>();

    public boolean isSuccess() {
        return errors.isEmpty();
    }

    public List<SemanticError> getErrors() {
        return Collections.unmodifiableList(errors);
    }

    public List<NestedFunctionNode> getNestedFunctions() {
        return Collections.unmodifiableList(nestedFunctions);
    }

    public List<CaptureRecord> getCaptures(NestedFunctionNode function) {
        return Collections.unmodifiableList(captures.getOrDefault(function, List.of()));
    }

    /**
     * 按名字取第一个同名嵌套函数的捕获列表
     */
    public List<CaptureRecord> getCaptures(String functionName) {
        for (NestedFunctionNode function : nestedFunctions) {
            if (function.name().equals(functionName)) {
                return getCaptures(function);
            }
        }
        return List.of();
    }

    public boolean hasMutableCapture(NestedFunctionNode function) {
        return getCaptures(function).stream().anyMatch(c -> c.kind() == CaptureKind.MUTABLE);
    }

    /**
     * 声明是否需要生成为可变绑定: 被某个嵌套函数可变捕获, 或在自身函数体内被直接写入
     */
    public boolean requiresMutable(AstNode declaration) {
        return mutableDeclarations.contains(declaration);
    }

    void registerNestedFunction(NestedFunctionNode function) {
        nestedFunctions.add(function);
        captures.put(function, new ArrayList<>());
    }

    void recordCapture(NestedFunctionNode function, String name, CaptureKind kind) {
        List<CaptureRecord> records = captures.computeIfAbsent(function, f -> new ArrayList<>());
        for (int i = 0; i < records.size(); i++) {
            CaptureRecord existing = records.get(i);
            if (existing.name().equals(name)) {
                if (kind == CaptureKind.MUTABLE && existing.kind() == CaptureKind.IMMUTABLE) {
                    records.set(i, existing.upgrade());
                }
                return;
            }
        }
        records.add(new CaptureRecord(name, kind));
    }

    void markMutable(AstNode declaration) {
        if (declaration != null) {
            mutableDeclarations.add(declaration);
        }
    }

    void addError(SemanticError error) {
        errors.add(error);
    }
}
