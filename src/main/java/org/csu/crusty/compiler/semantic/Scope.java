package org.csu.crusty.compiler.semantic;

import lombok.Getter;
import org.csu.crusty.compiler.parser.ast.statement.NestedFunctionNode;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * @author hidyouth
 * @description: 词法作用域. 名字在其声明语句分析完之后才加入作用域,
 * 因此后声明的名字对前面的嵌套函数不可见
 */
public class Scope {

    public enum Kind {
        GLOBAL,
        FUNCTION,
        BLOCK
    }

    @Getter
    private final Kind kind;
    @Getter
    private final Scope parent;
    /** 嵌套函数的函数作用域指向该函数; 顶层函数和块作用域为 null */
    @Getter
    private final NestedFunctionNode owner;
    private final Map<String, Binding> bindings = new LinkedHashMap<>();

    public Scope(Kind kind, Scope parent, NestedFunctionNode owner) {
        this.kind = kind;
        this.parent = parent;
        this.owner = owner;
    }

    public static Scope global() {
        return new Scope(Kind.GLOBAL, null, null);
    }

    public Scope child(Kind kind, NestedFunctionNode owner) {
        return new Scope(kind, this, owner);
    }

    public boolean isNestedFunctionBoundary() {
        return kind == Kind.FUNCTION && owner != null;
    }

    /**
     * @return 重名时返回 false, 绑定不会被覆盖
     */
    public boolean declare(Binding binding) {
        return bindings.putIfAbsent(binding.name(), binding) == null;
    }

    public Optional<Binding> lookupLocal(String name) {
        return Optional.ofNullable(bindings.get(name));
    }

    /**
     * 沿作用域链向外查找, 不记录捕获
     */
    public Optional<Binding> find(String name) {
        for (Scope s = this; s != null; s = s.parent) {
            Binding binding = s.bindings.get(name);
            if (binding != null) {
                return Optional.of(binding);
            }
        }
        return Optional.empty();
    }
}
