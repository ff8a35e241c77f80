package com.awesomeposter.core.guard;

/**
 * Thrown when a guard condition cannot be compiled.
 */
public class ConditionSyntaxException extends RuntimeException {

    private final String source;
    private final int position;

    public ConditionSyntaxException(String message, String source, int position) {
        super(message + " at position " + position + " in \"" + source + "\"");
        this.source = source;
        this.position = position;
    }

    public String getSource() {
        return source;
    }

    public int getPosition() {
        return position;
    }
}
