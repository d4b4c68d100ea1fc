package org.treefs.namespace.dto;

import java.util.List;

/**
 * 当前目录的列表结果。
 *
 * @param path    当前目录的绝对路径
 * @param empty   目录是否为空（与“没有返回条目”显式区分）
 * @param entries 子节点列表（默认插入顺序）
 */
public record DirectoryListing(
        String path,
        boolean empty,
        List<DirectoryEntry> entries
) {
}
