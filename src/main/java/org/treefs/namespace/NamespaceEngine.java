package org.treefs.namespace;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.treefs.namespace.dto.DirectoryEntry;
import org.treefs.namespace.dto.DirectoryListing;
import org.treefs.namespace.dto.NamespaceStats;
import org.treefs.namespace.dto.NodeInfo;
import org.treefs.namespace.dto.TreeEntry;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * 内存中的层级命名空间引擎。
 * <p>
 * 引擎独占根节点，并维护一个“当前目录”引用；创建、读写、删除、详情、列表都相对当前目录解析，
 * 搜索与统计则总是从根节点遍历整棵树。
 * <p>
 * 约束：
 * <ul>
 *   <li>同一目录下名称唯一（区分大小写），名称不能为空、不能包含 {@code /}。</li>
 *   <li>删除只作用于当前目录的直接子节点，且目录必须为空，因此当前目录及其祖先永远不会被删除。</li>
 *   <li>所有操作要么完整生效，要么抛出 {@link NamespaceException} 且不做任何修改。</li>
 * </ul>
 * <p>
 * 非线程安全：同一实例只能被一个线程串行调用（并发访问由调用方加锁，见 MCP 工具层）。
 */
public class NamespaceEngine {

    private static final Logger log = LoggerFactory.getLogger(NamespaceEngine.class);

    public static final String DEFAULT_ROOT_NAME = "root";
    public static final String PARENT = "..";

    private final Clock clock;
    private final Node root;
    private Node currentDir;

    public NamespaceEngine() {
        this(DEFAULT_ROOT_NAME, Clock.systemUTC());
    }

    public NamespaceEngine(String rootName, Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
        String resolvedRootName = (rootName == null || rootName.isBlank()) ? DEFAULT_ROOT_NAME : rootName;
        this.root = Node.directory(resolvedRootName, clock.instant());
        this.currentDir = root;
    }

    public void createFile(String name) {
        createFile(name, "");
    }

    public void createFile(String name, String content) {
        validateName(name);
        if (currentDir.hasChild(name)) {
            throw new AlreadyExistsException(name);
        }
        Node file = Node.file(name, content, clock.instant());
        currentDir.addChild(file);
        if (log.isDebugEnabled()) {
            log.debug("created file {} ({} bytes)", PathResolver.absolutePath(file), file.getSize());
        }
    }

    public void createDirectory(String name) {
        validateName(name);
        if (currentDir.hasChild(name)) {
            throw new AlreadyExistsException(name);
        }
        Node directory = Node.directory(name, clock.instant());
        currentDir.addChild(directory);
        if (log.isDebugEnabled()) {
            log.debug("created directory {}", PathResolver.absolutePath(directory));
        }
    }

    /**
     * 切换当前目录。
     * <p>
     * {@code ..} 回到父目录（已在根目录时失败）；{@code /} 回到根目录；其它值只匹配当前目录下的子目录，
     * 同名文件视为“目录不存在”。
     */
    public void changeDirectory(String target) {
        if (PARENT.equals(target)) {
            Node parent = currentDir.getParent();
            if (parent == null) {
                throw EntryNotFoundException.directory(target);
            }
            currentDir = parent;
            return;
        }
        if (PathResolver.ROOT_PATH.equals(target)) {
            currentDir = root;
            return;
        }
        Node child = lookup(target);
        if (child == null || !child.isDirectory()) {
            throw EntryNotFoundException.directory(target);
        }
        currentDir = child;
    }

    public void writeFile(String name, String content) {
        Node file = requireFile(name);
        file.writeContent(content, clock.instant());
        if (log.isDebugEnabled()) {
            log.debug("wrote file {} ({} bytes)", PathResolver.absolutePath(file), file.getSize());
        }
    }

    public String readFile(String name) {
        return requireFile(name).getContent();
    }

    /**
     * 删除当前目录下的文件或空目录（浅删除，不会递归删除非空目录）。
     */
    public void deleteEntry(String name) {
        Node target = lookup(name);
        if (target == null) {
            throw EntryNotFoundException.file(name);
        }
        if (target.isDirectory() && target.getChildCount() > 0) {
            throw new NonEmptyDirectoryException(name);
        }
        String path = log.isDebugEnabled() ? PathResolver.absolutePath(target) : null;
        currentDir.removeChild(name);
        target.destroy();
        if (path != null) {
            log.debug("deleted {}", path);
        }
    }

    public NodeInfo fileInfo(String name) {
        Node node = lookup(name);
        if (node == null) {
            throw EntryNotFoundException.file(name);
        }
        return toInfo(node);
    }

    public String getCurrentPath() {
        return PathResolver.absolutePath(currentDir);
    }

    public DirectoryListing listDirectory() {
        return listDirectory(false);
    }

    /**
     * @param sortByName true 时按名称排序，否则按插入顺序
     */
    public DirectoryListing listDirectory(boolean sortByName) {
        List<Node> children = new ArrayList<>(currentDir.getChildren());
        if (sortByName) {
            children.sort(Comparator.comparing(Node::getName));
        }
        List<DirectoryEntry> entries = new ArrayList<>(children.size());
        for (Node child : children) {
            Long size = (child.isFile() && child.getSize() > 0) ? child.getSize() : null;
            entries.add(new DirectoryEntry(child.getName(), child.getKind(), size));
        }
        return new DirectoryListing(getCurrentPath(), entries.isEmpty(), entries);
    }

    public NamespaceStats displayStats() {
        return TreeTraversal.stats(root);
    }

    /**
     * 在整棵树中查找名称包含 {@code query} 的文件，返回绝对路径列表。
     */
    public List<String> searchFile(String query) {
        return TreeTraversal.searchFiles(root, query == null ? "" : query);
    }

    /**
     * 深度优先枚举整棵树（供可视化前端绘制目录树）。
     */
    public List<TreeEntry> enumerateTree() {
        return TreeTraversal.enumerate(root, currentDir);
    }

    Node getRoot() {
        return root;
    }

    Node getCurrentDirectory() {
        return currentDir;
    }

    private Node requireFile(String name) {
        Node node = lookup(name);
        if (node == null || !node.isFile()) {
            throw EntryNotFoundException.file(name);
        }
        return node;
    }

    // 不合法的名称不可能存在于树中，直接视为未命中
    private Node lookup(String name) {
        if (!isValidName(name)) {
            return null;
        }
        return currentDir.getChild(name);
    }

    private NodeInfo toInfo(Node node) {
        return new NodeInfo(
                node.getName(),
                PathResolver.absolutePath(node),
                node.getKind(),
                node.getSize(),
                node.getCreatedTime(),
                node.getModifiedTime()
        );
    }

    private static void validateName(String name) {
        if (!isValidName(name)) {
            throw new InvalidNameException(name);
        }
    }

    static boolean isValidName(String name) {
        return name != null && !name.isEmpty() && name.indexOf(PathResolver.SEPARATOR) < 0;
    }
}
