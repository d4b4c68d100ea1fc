package org.treefs.namespace;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.unit.DataSize;
import org.springframework.validation.annotation.Validated;

/**
 * 命名空间 MCP Server 的业务配置（{@code app.ns.*}）。
 * <p>
 * 引擎本身只关心根节点名称；其余配置都是工具层的返回体积保护。
 * <p>
 * {@code app.ns} 下出现未知配置项时启动失败，避免拼错的 key 被静默忽略。
 */
@Validated
@ConfigurationProperties(prefix = "app.ns", ignoreUnknownFields = false)
public class NamespaceProperties {

    /**
     * 根节点的名称（不会出现在绝对路径里，只在目录树中展示）；与普通节点一样不能包含 {@code /}。
     */
    @NotBlank
    @Pattern(regexp = "[^/]+")
    private String rootName = NamespaceEngine.DEFAULT_ROOT_NAME;

    /**
     * {@code ns_list_directory} 默认是否按名称排序（false 表示按创建顺序）。
     */
    private boolean listSortByNameDefault = false;

    /**
     * {@code ns_create_file} / {@code ns_write_file} 单次写入内容的最大字节数。
     */
    @NotNull
    private DataSize writeMaxBytes = DataSize.ofMegabytes(1);

    /**
     * {@code ns_search} 最多返回多少条路径（上限保护；命中总数仍会如实返回）。
     */
    @Min(1)
    @Max(1_000_000)
    private int searchMaxResults = 1_000;

    /**
     * {@code ns_tree} 最多返回多少条目录树条目。
     */
    @Min(1)
    @Max(1_000_000)
    private int treeMaxEntries = 10_000;

    public String getRootName() {
        return rootName;
    }

    public void setRootName(String rootName) {
        this.rootName = rootName;
    }

    public boolean isListSortByNameDefault() {
        return listSortByNameDefault;
    }

    public void setListSortByNameDefault(boolean listSortByNameDefault) {
        this.listSortByNameDefault = listSortByNameDefault;
    }

    public DataSize getWriteMaxBytes() {
        return writeMaxBytes;
    }

    public void setWriteMaxBytes(DataSize writeMaxBytes) {
        this.writeMaxBytes = writeMaxBytes;
    }

    public int getSearchMaxResults() {
        return searchMaxResults;
    }

    public void setSearchMaxResults(int searchMaxResults) {
        this.searchMaxResults = searchMaxResults;
    }

    public int getTreeMaxEntries() {
        return treeMaxEntries;
    }

    public void setTreeMaxEntries(int treeMaxEntries) {
        this.treeMaxEntries = treeMaxEntries;
    }
}
