package org.treefs.namespace;

/**
 * 名称为空或包含路径分隔符。
 */
public class InvalidNameException extends NamespaceException {

    public InvalidNameException(String name) {
        super(NamespaceError.INVALID_NAME, name, "名称无效（不能为空且不能包含 '" + PathResolver.SEPARATOR + "'）：" + name);
    }
}
