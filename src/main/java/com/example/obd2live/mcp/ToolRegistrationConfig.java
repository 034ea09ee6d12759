package com.example.obd2live.mcp;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.ai.tool.ToolCallbackProvider;
import org.springframework.ai.tool.method.MethodToolCallbackProvider;

@Configuration
public class ToolRegistrationConfig {

    private final DiagnosticSessionTools sessionTools;
    private final CapabilitiesTools capTools;

    public ToolRegistrationConfig(DiagnosticSessionTools sessionTools, CapabilitiesTools capTools) {
        this.sessionTools = sessionTools;
        this.capTools = capTools;
    }

    @Bean
    public ToolCallbackProvider toolCallbacks() {
        return MethodToolCallbackProvider.builder()
                .toolObjects(sessionTools, capTools)
                .build();
    }
}
