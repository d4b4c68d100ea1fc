package org.treefs.namespace;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * 命名空间引擎的 Bean 装配。
 * <p>
 * 每个应用上下文只有一个引擎实例（即一个会话）；树完全在内存中，进程退出即丢弃。
 */
@Configuration(proxyBeanMethods = false)
public class NamespaceConfiguration {

    @Bean
    public Clock namespaceClock() {
        return Clock.systemUTC();
    }

    @Bean
    public NamespaceEngine namespaceEngine(NamespaceProperties properties, Clock namespaceClock) {
        return new NamespaceEngine(properties.getRootName(), namespaceClock);
    }
}
