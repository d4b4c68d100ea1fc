package org.treefs.namespace.dto;

import java.util.List;

/**
 * {@code ns_search} 的返回结果。
 *
 * @param query        搜索关键字（区分大小写的子串匹配）
 * @param totalMatches 全部命中数
 * @param truncated    是否因上限只返回了部分路径
 * @param paths        命中文件的绝对路径（深度优先顺序）
 */
public record SearchResult(
        String query,
        int totalMatches,
        boolean truncated,
        List<String> paths
) {
}
