package com.example.filterengine.mcp;

import org.springframework.ai.tool.ToolCallbackProvider;
import org.springframework.ai.tool.method.MethodToolCallbackProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ToolRegistrationConfig {

    private final FilterTools filterTools;
    private final CapabilitiesTools capTools;

    public ToolRegistrationConfig(FilterTools filterTools, CapabilitiesTools capTools) {
        this.filterTools = filterTools;
        this.capTools = capTools;
    }

    @Bean
    public ToolCallbackProvider filterToolCallbacks() {
        return MethodToolCallbackProvider.builder()
                .toolObjects(filterTools, capTools)
                .build();
    }
}
