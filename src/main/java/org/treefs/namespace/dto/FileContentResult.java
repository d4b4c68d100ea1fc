package org.treefs.namespace.dto;

import java.time.Instant;

/**
 * {@code ns_read_file} 的返回结果。
 *
 * @param path       文件绝对路径
 * @param sizeBytes  内容字节数
 * @param modifiedAt 最后修改时间
 * @param content    文件内容
 */
public record FileContentResult(
        String path,
        long sizeBytes,
        Instant modifiedAt,
        String content
) {
}
