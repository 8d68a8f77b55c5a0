package org.csu.crusty.compiler.semantic;

import org.csu.crusty.compiler.parser.ast.AstNode;
import org.csu.crusty.compiler.parser.ast.TypeNode;

/**
 * 作用域中的一个名字.
 *
 * @param name        名字
 * @param mutability  声明方式
 * @param position    在所在块中的语句序号, 参数为 -1
 * @param type        声明的或推断出的类型, 未知时为 null
 * @param declaration 声明它的AST节点 (let/var/const 语句, 参数, 嵌套函数), 全局名字为 null
 */
public record Binding(String name, Mutability mutability, int position, TypeNode type, AstNode declaration) {

    public static final int PARAMETER_POSITION = -1;

    public enum Mutability {
        IMMUTABLE,
        MUTABLE,
        CONST,
        FUNCTION
    }
}
