package org.treefs.mcp;

import org.springframework.ai.support.ToolCallbacks;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Arrays;
import java.util.List;

/**
 * 把 {@link NamespaceMcpTools} 上的 {@code @Tool} 方法注册为 MCP 工具。
 */
@Configuration
public class McpToolConfiguration {

    @Bean
    public List<ToolCallback> namespaceToolCallbacks(NamespaceMcpTools tools) {
        return Arrays.asList(ToolCallbacks.from(tools));
    }
}
