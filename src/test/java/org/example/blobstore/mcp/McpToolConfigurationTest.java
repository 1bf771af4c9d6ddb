package org.example.blobstore.mcp;

import org.example.blobstore.storage.filesystem.BlobStorageProperties;
import org.example.blobstore.storage.filesystem.FileSystemStorageProvider;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.ai.tool.ToolCallback;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class McpToolConfigurationTest {

    @TempDir
    Path root;

    @Test
    void blobToolCallbacks_exposeEveryStorageTool() {
        BlobMcpTools tools = new BlobMcpTools(new FileSystemStorageProvider(root), new BlobStorageProperties());

        List<String> names = new McpToolConfiguration().blobToolCallbacks(tools).stream()
                .map(ToolCallback::getToolDefinition)
                .map(definition -> definition.name())
                .toList();

        assertThat(names).hasSize(14)
                .allMatch(name -> name.startsWith("blob_"))
                .contains("blob_save_content", "blob_read_file", "blob_list_folders", "blob_file_exists");
    }
}
