package com.agentswarm.common.exception;

/**
 * The backing store of an adaptive controller cannot be read or written.
 * Never crosses a controller boundary: callers degrade to static behaviour.
 */
public class LearningStoreUnavailableException extends RuntimeException {

    private final String storeName;

    public LearningStoreUnavailableException(String storeName, String message, Throwable cause) {
        super("[" + storeName + "] " + message, cause);
        this.storeName = storeName;
    }

    public String getStoreName() {
        return storeName;
    }
}
