package org.csu.crusty.common.model;

/**
 * 源码中的一个位置, 行列号均从 1 开始
 *
 * @param line   行号
 * @param column 列号
 */
public record Position(int line, int column) {

    @Override
    public String toString() {
        return line + ":" + column;
    }
}
