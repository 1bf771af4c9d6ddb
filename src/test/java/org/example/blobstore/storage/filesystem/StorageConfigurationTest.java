package org.example.blobstore.storage.filesystem;

import org.example.blobstore.storage.AsyncStorageProvider;
import org.example.blobstore.storage.StorageProvider;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class StorageConfigurationTest {

    @TempDir
    Path tempDir;

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withUserConfiguration(PropertiesConfig.class, StorageConfiguration.class);

    @Test
    void wiresProviderAndCreatesRoot() {
        Path root = tempDir.resolve("store");
        runner.withPropertyValues(
                "app.storage.root=" + root,
                "app.storage.copy-buffer-size=4KB",
                "app.storage.path-case-sensitivity=SENSITIVE"
        ).run(context -> {
            assertThat(context).hasSingleBean(StorageProvider.class);
            assertThat(context).doesNotHaveBean(AsyncStorageProvider.class);
            assertThat(root).isDirectory();

            StorageProvider provider = context.getBean(StorageProvider.class);
            provider.createFolder("wired");
            assertThat(root.resolve("wired")).isDirectory();
            assertThat(context.getBean(StoragePathResolver.class).isCaseInsensitive()).isFalse();
        });
    }

    @Test
    void rejectsOutOfRangeCopyBuffer() {
        runner.withPropertyValues(
                "app.storage.root=" + tempDir.resolve("store"),
                "app.storage.copy-buffer-size=0B"
        ).run(context -> assertThat(context).hasFailed());
    }

    @Configuration(proxyBeanMethods = false)
    @EnableConfigurationProperties(BlobStorageProperties.class)
    static class PropertiesConfig {
    }
}
