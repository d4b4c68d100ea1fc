package org.treefs.namespace.dto;

import java.util.List;

/**
 * {@code ns_tree} 的返回结果。
 *
 * @param currentPath 当前工作目录
 * @param maxEntries  本次实际使用的最大条目数
 * @param truncated   是否因超出 maxEntries 被截断
 * @param entries     目录树条目（按遍历顺序）
 */
public record TreeResult(
        String currentPath,
        int maxEntries,
        boolean truncated,
        List<TreeEntry> entries
) {
}
