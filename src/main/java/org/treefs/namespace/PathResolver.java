package org.treefs.namespace;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * 绝对路径解析：沿 parent 引用向上走到根（不含根），再按“根 -> 节点”顺序用分隔符拼接。
 * <p>
 * 路径每次按需计算，不做缓存，因此结构修改后立即一致。
 */
public final class PathResolver {

    public static final char SEPARATOR = '/';
    public static final String ROOT_PATH = String.valueOf(SEPARATOR);

    private PathResolver() {
    }

    public static String absolutePath(Node node) {
        Deque<String> names = new ArrayDeque<>();
        Node current = node;
        while (current != null && current.getParent() != null) {
            names.push(current.getName());
            current = current.getParent();
        }
        if (names.isEmpty()) {
            return ROOT_PATH;
        }
        StringBuilder path = new StringBuilder();
        for (String name : names) {
            path.append(SEPARATOR).append(name);
        }
        return path.toString();
    }

    /**
     * 在父路径下拼接子节点名称（父路径为根时不重复分隔符）。
     */
    public static String child(String parentPath, String name) {
        if (ROOT_PATH.equals(parentPath)) {
            return ROOT_PATH + name;
        }
        return parentPath + SEPARATOR + name;
    }
}
