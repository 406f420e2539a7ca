package dev.mass.mcp;

import org.springframework.ai.tool.ToolCallbackProvider;
import org.springframework.ai.tool.method.MethodToolCallbackProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Publishes the {@link McpToolService} methods to Spring AI's MCP server auto-configuration. */
@Configuration
public class McpToolConfig {

    @Bean
    public ToolCallbackProvider massTools(McpToolService toolService) {
        return MethodToolCallbackProvider.builder()
                .toolObjects(toolService)
                .build();
    }
}
