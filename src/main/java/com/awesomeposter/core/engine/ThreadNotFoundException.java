package com.awesomeposter.core.engine;

public class ThreadNotFoundException extends RuntimeException {

    public ThreadNotFoundException(String threadId) {
        super("No stored state for thread " + threadId);
    }
}
