package org.treefs.namespace;

/**
 * 命名空间引擎的失败基类。
 * <p>
 * 所有失败都是“当前树状态 + 输入”的确定性结果：操作要么完整生效，要么不产生任何修改。
 */
public abstract class NamespaceException extends RuntimeException {

    private final NamespaceError error;
    private final String name;

    protected NamespaceException(NamespaceError error, String name, String message) {
        super(message);
        this.error = error;
        this.name = name;
    }

    public NamespaceError getError() {
        return error;
    }

    /**
     * 触发失败的名称（原样返回调用方传入的值，可能为 null）。
     */
    public String getName() {
        return name;
    }
}
