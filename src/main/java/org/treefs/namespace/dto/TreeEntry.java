package org.treefs.namespace.dto;

import org.treefs.namespace.NodeKind;

/**
 * 目录树条目（深度优先先序）。
 * <p>
 * 可视化前端只依赖这些字段即可画出任意形式的目录树。
 *
 * @param depth     深度（根为 0）
 * @param name      名称
 * @param path      绝对路径
 * @param kind      类型
 * @param sizeBytes 文件大小（目录为 null）
 * @param current   是否为当前工作目录
 */
public record TreeEntry(
        int depth,
        String name,
        String path,
        NodeKind kind,
        Long sizeBytes,
        boolean current
) {
}
