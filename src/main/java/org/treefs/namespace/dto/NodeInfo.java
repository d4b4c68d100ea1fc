package org.treefs.namespace.dto;

import org.treefs.namespace.NodeKind;

import java.time.Instant;

/**
 * 单个节点的详细信息（{@code fileInfo}）。
 *
 * @param name       名称
 * @param path       绝对路径
 * @param kind       类型
 * @param sizeBytes  大小（文件为内容字节数，目录为 0）
 * @param createdAt  创建时间
 * @param modifiedAt 最后修改时间
 */
public record NodeInfo(
        String name,
        String path,
        NodeKind kind,
        long sizeBytes,
        Instant createdAt,
        Instant modifiedAt
) {
}
