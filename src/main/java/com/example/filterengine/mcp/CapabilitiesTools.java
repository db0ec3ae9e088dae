package com.example.filterengine.mcp;

import org.springframework.ai.tool.annotation.Tool;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

@Service
public class CapabilitiesTools {

    static final List<String> TOOLS = List.of("evaluate_filter", "list_filter_runs", "get_filter_run", "capabilities_list");

    @Tool(description = "List available tool names and counts for introspection")
    public Map<String, Object> capabilities_list() {
        // static on purpose: this bean is itself registered in the tool provider
        return Map.of(
                "server", Map.of("name", "model-filter-engine", "version", "0.1.0"),
                "tools", TOOLS,
                "toolCount", TOOLS.size(),
                "capabilities", Map.of(
                        "tools", true,
                        "resources", false,
                        "prompts", false
                )
        );
    }
}
