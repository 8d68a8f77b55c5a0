package org.csu.crusty.common.model;

/**
 * @author hidyouth
 * @description: 源码区间 [start, end], 用于错误定位
 */
public record Span(Position start, Position end) {

    /** 手工构造的AST节点没有源码位置 */
    public static final Span UNKNOWN = Span.at(0, 0);

    public static Span of(int line, int column, int endLine, int endColumn) {
        return new Span(new Position(line, column), new Position(endLine, endColumn));
    }

    public static Span at(int line, int column) {
        Position p = new Position(line, column);
        return new Span(p, p);
    }

    /**
     * 合并两个区间, 取前者的起点和后者的终点
     */
    public Span to(Span other) {
        return new Span(start, other.end);
    }

    @Override
    public String toString() {
        return start + "-" + end;
    }
}
