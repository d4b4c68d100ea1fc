package org.treefs.namespace.dto;

import org.treefs.namespace.NodeKind;

/**
 * 目录列表项（非递归）。
 *
 * @param name      名称
 * @param kind      类型
 * @param sizeBytes 文件大小（仅非空文件有值；目录与空文件为 null）
 */
public record DirectoryEntry(
        String name,
        NodeKind kind,
        Long sizeBytes
) {
}
