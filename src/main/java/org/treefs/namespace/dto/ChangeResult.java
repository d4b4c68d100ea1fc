package org.treefs.namespace.dto;

/**
 * 修改类工具（创建/写入/删除/切换目录）的返回结果。
 *
 * @param operation   执行的操作（例如 create_file、delete）
 * @param path        受影响节点的绝对路径
 * @param currentPath 操作完成后的当前工作目录
 * @param sizeBytes   写入/创建文件后的大小（其它操作为 null）
 */
public record ChangeResult(
        String operation,
        String path,
        String currentPath,
        Long sizeBytes
) {
}
