package org.treefs.namespace;

/**
 * 节点类型：文件或目录（创建后不可变）。
 */
public enum NodeKind {
    FILE,
    DIRECTORY
}
