package org.example.blobstore;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * 虚拟 Blob 存储 MCP 服务入口（stdio 传输）。
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class BlobStorageApplication {

    static final String DEFAULT_LOG_PATH = "logs";

    public static void main(String[] args) {
        Path logDirectory = logDirectory(System.getProperty("LOG_PATH"), System.getenv("LOG_PATH"));
        try {
            Files.createDirectories(logDirectory);
        } catch (IOException e) {
            // Logback 尚未启动，stdout 属于 MCP 通道，只能写 stderr
            System.err.println("日志目录创建失败：" + logDirectory + "（" + e.getMessage() + "）");
        }
        SpringApplication.run(BlobStorageApplication.class, args);
    }

    /**
     * 日志目录，与 logback-spring.xml 中的 {@code ${LOG_PATH:-logs}} 取值顺序一致：系统属性优先，其次环境变量。
     */
    static Path logDirectory(String systemProperty, String environment) {
        if (systemProperty != null && !systemProperty.isBlank()) {
            return Path.of(systemProperty.trim());
        }
        if (environment != null && !environment.isBlank()) {
            return Path.of(environment.trim());
        }
        return Path.of(DEFAULT_LOG_PATH);
    }
}
