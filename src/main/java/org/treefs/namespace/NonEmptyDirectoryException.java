package org.treefs.namespace;

/**
 * 只允许删除空目录；目录下仍有子节点时抛出。
 */
public class NonEmptyDirectoryException extends NamespaceException {

    public NonEmptyDirectoryException(String name) {
        super(NamespaceError.DIRECTORY_NOT_EMPTY, name, "目录非空，无法删除：" + name);
    }
}
