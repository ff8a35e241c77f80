package com.awesomeposter.core.llm;

/**
 * Thrown when model output cannot be read as the requested type, even leniently.
 */
public class LlmParseException extends RuntimeException {

    private final Class<?> outputType;

    public LlmParseException(Class<?> outputType, String message, Throwable cause) {
        super("Could not parse model output as " + outputType.getSimpleName() + ": " + message, cause);
        this.outputType = outputType;
    }

    public Class<?> getOutputType() {
        return outputType;
    }
}
