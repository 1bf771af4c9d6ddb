package org.example.blobstore.mcp;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.support.ToolCallbacks;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Arrays;
import java.util.List;

/**
 * 存储工具注册：把 {@link BlobMcpTools} 上的 {@code blob_*} 方法转换成 {@link ToolCallback}。
 * <p>
 * MCP Server 自动配置从容器中收集这些回调，客户端看到的就是一组按存储根目录相对路径操作的
 * 文件/目录工具；根目录本身不会出现在任何工具参数或返回值里。
 */
@Configuration(proxyBeanMethods = false)
public class McpToolConfiguration {

    private static final Logger log = LoggerFactory.getLogger(McpToolConfiguration.class);

    @Bean
    public List<ToolCallback> blobToolCallbacks(BlobMcpTools tools) {
        List<ToolCallback> callbacks = Arrays.asList(ToolCallbacks.from(tools));
        log.info("已注册存储工具 {} 个", callbacks.size());
        return callbacks;
    }
}
