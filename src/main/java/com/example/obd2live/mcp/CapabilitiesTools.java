package com.example.obd2live.mcp;

import org.springframework.ai.tool.annotation.Tool;
import org.springframework.stereotype.Service;

import java.util.Map;

@Service
public class CapabilitiesTools {

    @Tool(description = "List server identity and capabilities for introspection")
    public Map<String,Object> capabilities_list() {
        return Map.of(
                "server", Map.of("name", "obd2-live-diagnostics", "version", "0.1.0"),
                "capabilities", Map.of(
                    "tools", true,
                    "resources", false,
                    "prompts", false,
                    "completion", false
                ),
                "toolGroups", Map.of(
                    "session", "start, end, get, updateStatus, addDataPoint, recent, intervalResults, share",
                    "buffer", "stats"
                )
        );
    }
}
