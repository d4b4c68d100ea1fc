package org.treefs;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

@SpringBootApplication
@ConfigurationPropertiesScan
public class TreeFsApplication {
    public static void main(String[] args) {
        ensureLogDirectory(resolveLogPath());
        SpringApplication.run(TreeFsApplication.class, args);
    }

    /**
     * 日志目录：与 logback-spring.xml 一致，系统属性优先，其次环境变量 LOG_PATH，默认 ./logs。
     */
    static String resolveLogPath() {
        String logPath = System.getProperty("LOG_PATH");
        if (logPath == null || logPath.isBlank()) {
            logPath = System.getenv("LOG_PATH");
        }
        if (logPath == null || logPath.isBlank()) {
            logPath = "logs";
        }
        return logPath;
    }

    /**
     * 提前创建日志目录，RollingFileAppender 不会自动创建父目录。
     */
    static void ensureLogDirectory(String logPath) {
        try {
            Files.createDirectories(Path.of(logPath));
        } catch (IOException e) {
            throw new UncheckedIOException("无法创建日志目录：" + logPath, e);
        }
    }
}
