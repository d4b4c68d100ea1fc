package org.treefs.namespace;

/**
 * 当前目录下已存在同名的文件或目录。
 */
public class AlreadyExistsException extends NamespaceException {

    public AlreadyExistsException(String name) {
        super(NamespaceError.ALREADY_EXISTS, name, "已存在同名条目：" + name);
    }
}
