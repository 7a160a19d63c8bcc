package dev.beacon.mcp;

import org.springframework.ai.tool.ToolCallbackProvider;
import org.springframework.ai.tool.method.MethodToolCallbackProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Registers {@link ContextToolService} methods as MCP tools via Spring AI auto-configuration.
 *
 * @see ContextToolService
 */
@Configuration
public class McpToolConfig {

    @Bean
    public ToolCallbackProvider beaconTools(ContextToolService toolService) {
        return MethodToolCallbackProvider.builder()
                .toolObjects(toolService)
                .build();
    }
}
