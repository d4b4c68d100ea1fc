package org.treefs.namespace.dto;

/**
 * 整棵树的聚合统计。
 *
 * @param directoryCount 目录数（包含根目录）
 * @param fileCount      文件数
 * @param totalBytes     所有文件内容的总字节数
 */
public record NamespaceStats(
        long directoryCount,
        long fileCount,
        long totalBytes
) {
}
