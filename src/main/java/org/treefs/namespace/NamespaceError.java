package org.treefs.namespace;

/**
 * 命名空间操作失败的类别。
 * <p>
 * 调用方（例如 MCP 工具层）可以按类别区分失败原因，而不必解析异常消息。
 */
public enum NamespaceError {
    INVALID_NAME,
    ALREADY_EXISTS,
    FILE_NOT_FOUND,
    DIRECTORY_NOT_FOUND,
    DIRECTORY_NOT_EMPTY
}
