package org.treefs.namespace;

import org.treefs.namespace.dto.NamespaceStats;
import org.treefs.namespace.dto.TreeEntry;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * 整棵树的遍历：文件名子串搜索、聚合统计、目录树枚举。
 * <p>
 * 三者都是从给定节点出发的深度优先先序遍历，同一层按子节点插入顺序访问。
 * 遍历使用显式栈而不是递归，树的深度不受线程栈大小限制。
 */
final class TreeTraversal {

    private TreeTraversal() {
    }

    /**
     * 搜索名称包含 {@code query} 的文件（区分大小写）。
     * <p>
     * 目录本身不会命中，但无论名称是否匹配都会继续向下遍历。
     */
    static List<String> searchFiles(Node root, String query) {
        List<String> results = new ArrayList<>();
        Deque<Frame> stack = new ArrayDeque<>();
        stack.push(new Frame(root, PathResolver.absolutePath(root), 0));
        while (!stack.isEmpty()) {
            Frame frame = stack.pop();
            Node node = frame.node();
            if (node.isFile()) {
                if (node.getName().contains(query)) {
                    results.add(frame.path());
                }
                continue;
            }
            pushChildren(stack, frame);
        }
        return results;
    }

    static NamespaceStats stats(Node root) {
        long directories = 0;
        long files = 0;
        long totalBytes = 0;
        Deque<Node> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            Node node = stack.pop();
            if (node.isDirectory()) {
                directories++;
                for (Node child : node.getChildren()) {
                    stack.push(child);
                }
            } else {
                files++;
                totalBytes += node.getSize();
            }
        }
        return new NamespaceStats(directories, files, totalBytes);
    }

    /**
     * 先序枚举整棵树，并标记当前工作目录。
     */
    static List<TreeEntry> enumerate(Node root, Node currentDir) {
        List<TreeEntry> entries = new ArrayList<>();
        Deque<Frame> stack = new ArrayDeque<>();
        stack.push(new Frame(root, PathResolver.absolutePath(root), 0));
        while (!stack.isEmpty()) {
            Frame frame = stack.pop();
            Node node = frame.node();
            entries.add(new TreeEntry(
                    frame.depth(),
                    node.getName(),
                    frame.path(),
                    node.getKind(),
                    node.isFile() ? node.getSize() : null,
                    node == currentDir
            ));
            pushChildren(stack, frame);
        }
        return entries;
    }

    // 逆序入栈，出栈时即为插入顺序
    private static void pushChildren(Deque<Frame> stack, Frame parent) {
        List<Node> children = parent.node().getChildren();
        for (int i = children.size() - 1; i >= 0; i--) {
            Node child = children.get(i);
            stack.push(new Frame(child, PathResolver.child(parent.path(), child.getName()), parent.depth() + 1));
        }
    }

    private record Frame(Node node, String path, int depth) {
    }
}
