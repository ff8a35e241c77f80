package com.awesomeposter.core.capability;

import com.awesomeposter.core.guard.GuardDefinition;
import com.awesomeposter.core.guard.GuardEvaluator;
import com.awesomeposter.core.llm.LlmService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.ai.tool.ToolCallbackProvider;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Builds the process-wide {@link CapabilityRegistry} from configured prompt capabilities
 * plus any {@link Capability} beans in the context.
 */
@Configuration
public class CapabilityConfig {

    private static final Logger log = LoggerFactory.getLogger(CapabilityConfig.class);

    @Bean
    public CapabilityRegistry capabilityRegistry(CapabilityProperties properties,
                                                 LlmService llmService,
                                                 GuardEvaluator guardEvaluator,
                                                 ObjectProvider<ToolCallbackProvider> toolProviders,
                                                 ObjectProvider<Capability> capabilityBeans) {
        List<ToolCallback> allTools = toolProviders.orderedStream()
                .flatMap(provider -> Arrays.stream(provider.getToolCallbacks()))
                .toList();

        CapabilityRegistry registry = new CapabilityRegistry();
        for (CapabilityProperties.Definition def : properties.getCapabilities()) {
            List<GuardDefinition> guards = def.getGuards().stream()
                    .map(g -> guardEvaluator.define(g.getFacet(), g.getPath(), g.getCondition()))
                    .toList();
            var registration = new CapabilityRegistration(def.getId(),
                    def.getName() != null ? def.getName() : def.getId(),
                    new LinkedHashSet<>(def.getInputFacets()),
                    new LinkedHashSet<>(def.getOutputFacets()),
                    def.getTools(),
                    guards);
            List<ToolCallback> tools = allTools.stream()
                    .filter(t -> def.getTools().contains(t.getToolDefinition().name()))
                    .toList();
            if (tools.size() < def.getTools().size()) {
                log.warn("Capability {} allows tools {} but only {} are available",
                        def.getId(), def.getTools(), tools.size());
            }
            registry.register(new LlmCapability(registration, def.getSystemPrompt(), llmService, tools));
        }
        capabilityBeans.orderedStream().forEach(registry::register);
        return registry;
    }
}
