package org.csu.crusty.compiler.parser;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * @author hidyouth
 * @description: 宏注册表, 每个 Parser 实例一份.
 * 记录每个宏的括号种类, 之后的每次调用都按它检查
 */
public class MacroRegistry {

    private final Map<String, MacroRegistryEntry> entries = new LinkedHashMap<>();

    /**
     * 名字是否符合 __NAME__ 的双下划线约定
     */
    public static boolean isMacroName(String name) {
        return hasMacroPrefix(name) && hasMacroSuffix(name);
    }

    public static boolean hasMacroPrefix(String name) {
        return name.startsWith("__");
    }

    public static boolean hasMacroSuffix(String name) {
        // "__" 或 "___" 的前后缀会重叠, 不算合法
        return name.length() > 4 && name.endsWith("__");
    }

    /**
     * 同名宏只保留第一次定义, 重复定义由语义分析报告
     */
    public void register(MacroRegistryEntry entry) {
        entries.putIfAbsent(entry.name(), entry);
    }

    public Optional<MacroRegistryEntry> lookup(String name) {
        return Optional.ofNullable(entries.get(name));
    }

    public boolean isRegistered(String name) {
        return entries.containsKey(name);
    }

    public Collection<MacroRegistryEntry> entries() {
        return Collections.unmodifiableCollection(entries.values());
    }

    public int size() {
        return entries.size();
    }
}
