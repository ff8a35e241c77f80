package com.awesomeposter.core.llm;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.module.paramnames.ParameterNamesModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.converter.BeanOutputConverter;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * The model-calling runtime used by the planner and prompt-driven capabilities.
 * <p>
 * Wraps Spring AI's {@link ChatClient}: a {@link BeanOutputConverter} derives a JSON schema
 * from the target type and appends format instructions to the user prompt. When the
 * converter rejects the reply, a lenient Jackson pass strips markdown fences and retries.
 */
@Service
public class LlmService {

    private static final Logger log = LoggerFactory.getLogger(LlmService.class);

    private final ChatClient chatClient;
    private final ObjectMapper lenientMapper = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .configure(DeserializationFeature.ACCEPT_EMPTY_STRING_AS_NULL_OBJECT, true)
            .configure(DeserializationFeature.ACCEPT_SINGLE_VALUE_AS_ARRAY, true)
            .registerModule(new ParameterNamesModule());

    public LlmService(ChatClient.Builder builder,
                      @Value("${spring.ai.openai.base-url:NOT_SET}") String baseUrl) {
        this.chatClient = builder.build();
        log.info("LlmService initialized, OpenAI base-url: {}", baseUrl);
    }

    /**
     * Sends a system and user prompt and returns the reply as {@code outputType}.
     *
     * @throws LlmEmptyResponseException if the model returns nothing
     * @throws LlmParseException         if the reply cannot be read as {@code outputType}
     */
    public <T> T structuredCall(String systemPrompt, String userPrompt, Class<T> outputType) {
        return structuredCallWithTools(systemPrompt, userPrompt, outputType, List.of());
    }

    /**
     * Like {@link #structuredCall} but lets the model call the given tools.
     */
    public <T> T structuredCallWithTools(String systemPrompt, String userPrompt, Class<T> outputType,
                                         List<ToolCallback> tools) {
        var converter = new BeanOutputConverter<>(outputType);
        long start = System.currentTimeMillis();
        var request = chatClient.prompt()
                .system(systemPrompt)
                .user(userPrompt + "\n\n" + converter.getFormat());
        if (tools != null && !tools.isEmpty()) {
            request = request.toolCallbacks(tools);
        }
        String response = request.call().content();
        log.info("Model call for {} took {}ms ({} tools)", outputType.getSimpleName(),
                System.currentTimeMillis() - start, tools != null ? tools.size() : 0);

        if (response == null || response.isBlank()) {
            throw new LlmEmptyResponseException(outputType);
        }
        try {
            return converter.convert(response);
        } catch (RuntimeException e) {
            log.warn("Structured conversion to {} failed ({}); retrying leniently",
                    outputType.getSimpleName(), e.getMessage());
            log.debug("Raw model response: {}", response);
            return parseLeniently(response, outputType);
        }
    }

    <T> T parseLeniently(String json, Class<T> outputType) {
        String cleaned = json.trim();
        if (cleaned.startsWith("```json")) {
            cleaned = cleaned.substring(7);
        } else if (cleaned.startsWith("```")) {
            cleaned = cleaned.substring(3);
        }
        if (cleaned.endsWith("```")) {
            cleaned = cleaned.substring(0, cleaned.length() - 3);
        }
        try {
            return lenientMapper.readValue(cleaned.trim(), outputType);
        } catch (Exception e) {
            throw new LlmParseException(outputType, e.getMessage(), e);
        }
    }
}
