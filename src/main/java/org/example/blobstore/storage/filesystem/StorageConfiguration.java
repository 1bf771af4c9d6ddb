package org.example.blobstore.storage.filesystem;

import org.example.blobstore.storage.StorageProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * 文件系统存储的 Bean 装配。
 * <p>
 * 说明：
 * <ul>
 *   <li>根目录在这里（而不是在存储提供者内部）按需创建，提供者本身只假定根目录已存在。</li>
 *   <li>这里不引入任何数据库/外部依赖，全部基于本地文件系统。</li>
 *   <li>不注册后台线程池：MCP 工具同步调用提供者；需要异步派发的调用方自行用 {@code AsyncStorageProvider} 包装。</li>
 * </ul>
 */
@Configuration(proxyBeanMethods = false)
public class StorageConfiguration {

    private static final Logger log = LoggerFactory.getLogger(StorageConfiguration.class);

    @Bean
    public StoragePathResolver storagePathResolver(BlobStorageProperties properties) {
        Path root = Path.of(properties.getRoot()).toAbsolutePath().normalize();
        try {
            Files.createDirectories(root);
        } catch (IOException e) {
            throw new IllegalStateException("存储根目录无法创建：" + root, e);
        }
        StoragePathResolver resolver = new StoragePathResolver(root, properties.getPathCaseSensitivity());
        log.info("存储根目录：{}（大小写{}）", root, resolver.isCaseInsensitive() ? "不敏感" : "敏感");
        return resolver;
    }

    @Bean
    public StorageProvider storageProvider(StoragePathResolver resolver, BlobStorageProperties properties) {
        return new FileSystemStorageProvider(resolver, copyBufferSize(properties));
    }

    static int copyBufferSize(BlobStorageProperties properties) {
        long bytes = properties.getCopyBufferSize().toBytes();
        if (bytes < 1 || bytes > BlobStorageProperties.MAX_COPY_BUFFER_SIZE.toBytes()) {
            throw new IllegalStateException("app.storage.copy-buffer-size 超出范围（1B ~ 16MB）：" + properties.getCopyBufferSize());
        }
        return (int) bytes;
    }
}
