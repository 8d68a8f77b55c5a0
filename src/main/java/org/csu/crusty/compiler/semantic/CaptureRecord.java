package org.csu.crusty.compiler.semantic;

/**
 * @param name 被捕获的外层绑定名
 * @param kind 捕获方式
 */
public record CaptureRecord(String name, CaptureKind kind) {

    public CaptureRecord upgrade() {
        return new CaptureRecord(name, CaptureKind.MUTABLE);
    }
}
