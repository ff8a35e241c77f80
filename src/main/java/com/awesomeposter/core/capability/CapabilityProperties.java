package com.awesomeposter.core.capability;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Prompt-driven capabilities declared under {@code awesomeposter.capabilities}.
 */
@Component
@ConfigurationProperties(prefix = "awesomeposter")
public class CapabilityProperties {

    private List<Definition> capabilities = new ArrayList<>();

    public List<Definition> getCapabilities() { return capabilities; }
    public void setCapabilities(List<Definition> capabilities) { this.capabilities = capabilities; }

    public static class Definition {
        private String id;
        private String name;
        private String systemPrompt = "";
        private List<String> inputFacets = new ArrayList<>();
        private List<String> outputFacets = new ArrayList<>();
        private List<String> tools = new ArrayList<>();
        private List<Guard> guards = new ArrayList<>();

        public String getId() { return id; }
        public void setId(String id) { this.id = id; }
        public String getName() { return name; }
        public void setName(String name) { this.name = name; }
        public String getSystemPrompt() { return systemPrompt; }
        public void setSystemPrompt(String systemPrompt) { this.systemPrompt = systemPrompt; }
        public List<String> getInputFacets() { return inputFacets; }
        public void setInputFacets(List<String> inputFacets) { this.inputFacets = inputFacets; }
        public List<String> getOutputFacets() { return outputFacets; }
        public void setOutputFacets(List<String> outputFacets) { this.outputFacets = outputFacets; }
        public List<String> getTools() { return tools; }
        public void setTools(List<String> tools) { this.tools = tools; }
        public List<Guard> getGuards() { return guards; }
        public void setGuards(List<Guard> guards) { this.guards = guards; }
    }

    public static class Guard {
        private String facet;
        private String path = "";
        private String condition;

        public String getFacet() { return facet; }
        public void setFacet(String facet) { this.facet = facet; }
        public String getPath() { return path; }
        public void setPath(String path) { this.path = path; }
        public String getCondition() { return condition; }
        public void setCondition(String condition) { this.condition = condition; }
    }
}
