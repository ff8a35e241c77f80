package com.awesomeposter.core.llm;

/**
 * Thrown when the model returns no content at all.
 */
public class LlmEmptyResponseException extends RuntimeException {

    private final Class<?> outputType;

    public LlmEmptyResponseException(Class<?> outputType) {
        super("Model returned empty content for " + outputType.getSimpleName()
                + "; check that the model is reachable and supports structured JSON output");
        this.outputType = outputType;
    }

    public Class<?> getOutputType() {
        return outputType;
    }
}
