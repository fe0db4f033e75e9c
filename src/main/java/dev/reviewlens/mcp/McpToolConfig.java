package dev.reviewlens.mcp;

import org.springframework.ai.tool.ToolCallbackProvider;
import org.springframework.ai.tool.method.MethodToolCallbackProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Publishes the {@code @Tool} methods of {@link ReviewToolService} to the Spring AI MCP server over
 * the configured transport.
 */
@Configuration
public class McpToolConfig {

    @Bean
    public ToolCallbackProvider reviewTools(ReviewToolService toolService) {
        return MethodToolCallbackProvider.builder()
                .toolObjects(toolService)
                .build();
    }
}
