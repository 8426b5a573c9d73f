package io.secondbrain.config;

import io.secondbrain.tool.MemoryTools;
import org.springframework.ai.tool.ToolCallbackProvider;
import org.springframework.ai.tool.method.MethodToolCallbackProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Publishes the memory tools as Spring AI tool callbacks for chat clients and MCP servers.
 */
@Configuration
public class ToolConfig {

    @Bean
    public ToolCallbackProvider memoryToolCallbacks(MemoryTools memoryTools) {
        return MethodToolCallbackProvider.builder()
                .toolObjects(memoryTools)
                .build();
    }
}
