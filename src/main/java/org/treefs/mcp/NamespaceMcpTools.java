package org.treefs.mcp;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.ai.tool.annotation.ToolParam;
import org.springframework.stereotype.Component;
import org.treefs.namespace.NamespaceEngine;
import org.treefs.namespace.NamespaceException;
import org.treefs.namespace.NamespaceProperties;
import org.treefs.namespace.PathResolver;
import org.treefs.namespace.dto.ChangeResult;
import org.treefs.namespace.dto.DirectoryListing;
import org.treefs.namespace.dto.FileContentResult;
import org.treefs.namespace.dto.NamespaceStats;
import org.treefs.namespace.dto.NodeInfo;
import org.treefs.namespace.dto.SearchResult;
import org.treefs.namespace.dto.TreeEntry;
import org.treefs.namespace.dto.TreeResult;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * 命名空间 MCP 工具集合。
 * <p>
 * 提供能力：
 * <ul>
 *   <li>创建文件/目录（{@code ns_create_file}、{@code ns_create_directory}）。</li>
 *   <li>切换与查看当前目录（{@code ns_change_directory}、{@code ns_current_path}）。</li>
 *   <li>读写文件（{@code ns_read_file}、{@code ns_write_file}）与删除（{@code ns_delete}）。</li>
 *   <li>详情、列目录、全树统计、按文件名搜索、目录树（{@code ns_file_info}、{@code ns_list_directory}、
 *       {@code ns_stats}、{@code ns_search}、{@code ns_tree}）。</li>
 * </ul>
 * <p>
 * 并发策略：引擎本身不是线程安全的，且“当前目录”是所有调用共享的状态，因此每次工具调用都在同一把锁内完成。
 * <p>
 * 失败处理：引擎抛出的 {@link NamespaceException} 原样向上抛出，由 MCP 框架转换为工具错误结果；
 * 异常消息中包含出错的名称。
 */
@Component
public class NamespaceMcpTools {

    private static final Logger log = LoggerFactory.getLogger(NamespaceMcpTools.class);

    private final NamespaceEngine engine;
    private final NamespaceProperties properties;
    private final ReentrantLock lock = new ReentrantLock();

    public NamespaceMcpTools(NamespaceEngine engine, NamespaceProperties properties) {
        this.engine = engine;
        this.properties = properties;
    }

    @Tool(
            name = "ns_create_file",
            description = "在当前目录下创建文件（可选初始内容）；名称不能为空、不能包含 /，且不能与已有文件/目录重名。"
    )
    public ChangeResult createFile(
            @ToolParam(description = "文件名（不含路径分隔符）") String name,
            @ToolParam(required = false, description = "初始内容（为空则创建空文件）") String content
    ) {
        String resolvedContent = (content == null) ? "" : content;
        checkContentSize(resolvedContent);
        return withEngine("ns_create_file", () -> {
            engine.createFile(name, resolvedContent);
            NodeInfo info = engine.fileInfo(name);
            return new ChangeResult("create_file", info.path(), engine.getCurrentPath(), info.sizeBytes());
        });
    }

    @Tool(
            name = "ns_create_directory",
            description = "在当前目录下创建空目录；名称规则与 ns_create_file 相同。"
    )
    public ChangeResult createDirectory(
            @ToolParam(description = "目录名（不含路径分隔符）") String name
    ) {
        return withEngine("ns_create_directory", () -> {
            engine.createDirectory(name);
            String path = PathResolver.child(engine.getCurrentPath(), name);
            return new ChangeResult("create_directory", path, engine.getCurrentPath(), null);
        });
    }

    @Tool(
            name = "ns_change_directory",
            description = "切换当前目录：.. 为父目录，/ 为根目录，其它值为当前目录下的子目录名。"
    )
    public ChangeResult changeDirectory(
            @ToolParam(description = "目标：..、/ 或子目录名") String target
    ) {
        return withEngine("ns_change_directory", () -> {
            engine.changeDirectory(target);
            String current = engine.getCurrentPath();
            return new ChangeResult("change_directory", current, current, null);
        });
    }

    @Tool(
            name = "ns_write_file",
            description = "覆盖写入当前目录下已存在的文件（目录或不存在的文件都会报“文件不存在”）。"
    )
    public ChangeResult writeFile(
            @ToolParam(description = "文件名") String name,
            @ToolParam(description = "新内容（整体替换）") String content
    ) {
        String resolvedContent = (content == null) ? "" : content;
        checkContentSize(resolvedContent);
        return withEngine("ns_write_file", () -> {
            engine.writeFile(name, resolvedContent);
            NodeInfo info = engine.fileInfo(name);
            return new ChangeResult("write_file", info.path(), engine.getCurrentPath(), info.sizeBytes());
        });
    }

    @Tool(
            name = "ns_read_file",
            description = "读取当前目录下文件的完整内容。"
    )
    public FileContentResult readFile(
            @ToolParam(description = "文件名") String name
    ) {
        return withEngine("ns_read_file", () -> {
            String content = engine.readFile(name);
            NodeInfo info = engine.fileInfo(name);
            return new FileContentResult(info.path(), info.sizeBytes(), info.modifiedAt(), content);
        });
    }

    @Tool(
            name = "ns_delete",
            description = "删除当前目录下的文件或空目录（非空目录会失败，不会递归删除）。"
    )
    public ChangeResult delete(
            @ToolParam(description = "文件名或目录名") String name
    ) {
        return withEngine("ns_delete", () -> {
            String path = PathResolver.child(engine.getCurrentPath(), name);
            engine.deleteEntry(name);
            return new ChangeResult("delete", path, engine.getCurrentPath(), null);
        });
    }

    @Tool(
            name = "ns_file_info",
            description = "查看当前目录下文件或目录的详情（类型、大小、创建/修改时间）。"
    )
    public NodeInfo fileInfo(
            @ToolParam(description = "文件名或目录名") String name
    ) {
        return withEngine("ns_file_info", () -> engine.fileInfo(name));
    }

    @Tool(
            name = "ns_current_path",
            description = "返回当前目录的绝对路径（根目录为 /）。"
    )
    public String currentPath() {
        return withEngine("ns_current_path", engine::getCurrentPath);
    }

    @Tool(
            name = "ns_list_directory",
            description = "列出当前目录的子节点（默认按创建顺序；非空文件附带大小）。"
    )
    public DirectoryListing listDirectory(
            @ToolParam(required = false, description = "是否按名称排序（默认 app.ns.list-sort-by-name-default）") Boolean sortByName
    ) {
        boolean sortResolved = (sortByName != null) ? sortByName : properties.isListSortByNameDefault();
        return withEngine("ns_list_directory", () -> engine.listDirectory(sortResolved));
    }

    @Tool(
            name = "ns_stats",
            description = "统计整棵树：目录数（含根目录）、文件数、文件内容总字节数。"
    )
    public NamespaceStats stats() {
        return withEngine("ns_stats", engine::displayStats);
    }

    @Tool(
            name = "ns_search",
            description = "在整棵树中查找文件名包含关键字的文件（区分大小写，目录不参与匹配），返回绝对路径。"
    )
    public SearchResult search(
            @ToolParam(description = "文件名关键字（子串匹配）") String query
    ) {
        List<String> matches = withEngine("ns_search", () -> engine.searchFile(query));
        int limit = properties.getSearchMaxResults();
        boolean truncated = matches.size() > limit;
        List<String> returned = truncated ? List.copyOf(matches.subList(0, limit)) : matches;
        return new SearchResult(query, matches.size(), truncated, returned);
    }

    @Tool(
            name = "ns_tree",
            description = "深度优先返回整棵目录树（深度、名称、路径、类型、文件大小、是否为当前目录）。"
    )
    public TreeResult tree() {
        return withEngine("ns_tree", () -> {
            List<TreeEntry> entries = engine.enumerateTree();
            int limit = properties.getTreeMaxEntries();
            boolean truncated = entries.size() > limit;
            List<TreeEntry> returned = truncated ? List.copyOf(entries.subList(0, limit)) : entries;
            return new TreeResult(engine.getCurrentPath(), limit, truncated, returned);
        });
    }

    private <T> T withEngine(String tool, Supplier<T> action) {
        lock.lock();
        try {
            return action.get();
        } catch (NamespaceException e) {
            log.debug("{} 失败：{}（{}）", tool, e.getMessage(), e.getError());
            throw e;
        } finally {
            lock.unlock();
        }
    }

    private void checkContentSize(String content) {
        long bytes = content.getBytes(StandardCharsets.UTF_8).length;
        long maxBytes = properties.getWriteMaxBytes().toBytes();
        if (bytes > maxBytes) {
            throw new IllegalArgumentException("写入内容过大：" + bytes + " 字节（上限 " + maxBytes + "）");
        }
    }
}
