package org.treefs.namespace;

/**
 * 未找到目标条目。
 * <p>
 * 类型不匹配（例如对目录执行读文件、对文件执行 cd）与“不存在”对调用方不可区分，统一归为此异常，
 * 通过 {@link #getError()} 区分是按文件还是按目录查找失败。
 */
public class EntryNotFoundException extends NamespaceException {

    private EntryNotFoundException(NamespaceError error, String name, String message) {
        super(error, name, message);
    }

    public static EntryNotFoundException file(String name) {
        return new EntryNotFoundException(NamespaceError.FILE_NOT_FOUND, name, "文件不存在：" + name);
    }

    public static EntryNotFoundException directory(String name) {
        return new EntryNotFoundException(NamespaceError.DIRECTORY_NOT_FOUND, name, "目录不存在：" + name);
    }
}
