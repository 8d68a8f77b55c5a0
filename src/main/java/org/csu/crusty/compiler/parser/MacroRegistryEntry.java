package org.csu.crusty.compiler.parser;

import org.csu.crusty.compiler.lexer.Token;
import org.csu.crusty.compiler.parser.ast.MacroDelimiter;

import java.util.List;

/**
 * 宏注册表中的一项. 插入后只读
 *
 * @param name       宏名, 形如 __NAME__
 * @param delimiter  定义时参数列表使用的括号种类
 * @param params     形参名
 * @param body       宏体Token序列 (不解析)
 */
public record MacroRegistryEntry(String name, MacroDelimiter delimiter, List<String> params, List<Token> body) {
}
