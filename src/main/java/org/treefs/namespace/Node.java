package org.treefs.namespace;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 命名空间树中的一个节点（文件或目录）。
 * <p>
 * 所有权：
 * <ul>
 *   <li>父目录通过 {@link #children} 持有子节点；{@link #parent} 只是反向引用，不代表所有权。</li>
 *   <li>目录额外维护“名称 -> 子节点”索引，与有序子节点列表始终保持同一 key 集合。</li>
 *   <li>结构修改（增删子节点）不会改动时间戳，时间戳由引擎维护。</li>
 * </ul>
 * <p>
 * 本类不做名称校验与重名检查，调用方（{@link NamespaceEngine}）负责保证前置条件。
 */
public final class Node {

    private final String name;
    private final NodeKind kind;
    private final Instant createdTime;
    private Instant modifiedTime;
    private String content;
    private Node parent;

    // 仅目录使用：按插入顺序保存的子节点 + 名称索引
    private final List<Node> children;
    private final Map<String, Node> childIndex;

    private Node(String name, NodeKind kind, Instant createdTime) {
        this.name = name;
        this.kind = kind;
        this.createdTime = createdTime;
        this.modifiedTime = createdTime;
        if (kind == NodeKind.DIRECTORY) {
            this.content = null;
            this.children = new ArrayList<>();
            this.childIndex = new HashMap<>();
        } else {
            this.content = "";
            this.children = null;
            this.childIndex = null;
        }
    }

    static Node file(String name, String content, Instant createdTime) {
        Node node = new Node(name, NodeKind.FILE, createdTime);
        node.content = (content == null) ? "" : content;
        return node;
    }

    static Node directory(String name, Instant createdTime) {
        return new Node(name, NodeKind.DIRECTORY, createdTime);
    }

    public String getName() {
        return name;
    }

    public NodeKind getKind() {
        return kind;
    }

    public boolean isDirectory() {
        return kind == NodeKind.DIRECTORY;
    }

    public boolean isFile() {
        return kind == NodeKind.FILE;
    }

    public Instant getCreatedTime() {
        return createdTime;
    }

    public Instant getModifiedTime() {
        return modifiedTime;
    }

    /**
     * @return 父目录；根节点返回 null
     */
    public Node getParent() {
        return parent;
    }

    /**
     * @return 文件内容；目录没有内容概念，返回 null
     */
    public String getContent() {
        return content;
    }

    /**
     * 节点大小：文件为内容的 UTF-8 字节数，目录恒为 0。
     */
    public long getSize() {
        if (content == null || content.isEmpty()) {
            return 0L;
        }
        return content.getBytes(StandardCharsets.UTF_8).length;
    }

    /**
     * 替换文件内容并刷新修改时间。
     * <p>
     * 修改时间不会早于创建时间（时钟回拨时以创建时间为下限）。
     */
    void writeContent(String newContent, Instant now) {
        requireFile();
        this.content = (newContent == null) ? "" : newContent;
        this.modifiedTime = now.isBefore(createdTime) ? createdTime : now;
    }

    /**
     * @return 子节点只读视图（插入顺序）；文件返回空列表
     */
    public List<Node> getChildren() {
        if (children == null) {
            return List.of();
        }
        return Collections.unmodifiableList(children);
    }

    public int getChildCount() {
        return children == null ? 0 : children.size();
    }

    /**
     * 追加子节点并写入索引。调用方保证名称尚未存在。
     */
    void addChild(Node child) {
        requireDirectory();
        child.parent = this;
        children.add(child);
        childIndex.put(child.name, child);
    }

    /**
     * 从索引与有序列表中同时移除子节点，并断开其父引用。调用方保证名称存在。
     *
     * @return 被移除的子节点
     */
    Node removeChild(String childName) {
        requireDirectory();
        Node removed = childIndex.remove(childName);
        if (removed == null) {
            return null;
        }
        children.remove(removed);
        removed.parent = null;
        return removed;
    }

    /**
     * O(1) 按名称查找子节点。
     */
    public Node getChild(String childName) {
        if (childIndex == null) {
            return null;
        }
        return childIndex.get(childName);
    }

    public boolean hasChild(String childName) {
        return childIndex != null && childIndex.containsKey(childName);
    }

    /**
     * 释放当前节点及其拥有的整棵子树（后序：先释放子节点，再清空自身）。
     * <p>
     * 释放后节点不再挂在任何父目录下，也不再持有子节点。使用显式栈，深层子树不会耗尽线程栈。
     */
    void destroy() {
        Deque<Node> pending = new ArrayDeque<>();
        Deque<Node> postOrder = new ArrayDeque<>();
        pending.push(this);
        while (!pending.isEmpty()) {
            Node node = pending.pop();
            postOrder.push(node);
            for (Node child : node.getChildren()) {
                pending.push(child);
            }
        }
        while (!postOrder.isEmpty()) {
            postOrder.pop().release();
        }
    }

    private void release() {
        if (children != null) {
            children.clear();
            childIndex.clear();
        }
        parent = null;
        if (content != null) {
            content = "";
        }
    }

    private void requireDirectory() {
        if (children == null) {
            throw new IllegalStateException("不是目录：" + name);
        }
    }

    private void requireFile() {
        if (kind != NodeKind.FILE) {
            throw new IllegalStateException("不是文件：" + name);
        }
    }

    @Override
    public String toString() {
        return kind + ":" + name;
    }
}
