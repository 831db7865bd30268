package com.profileplatform.claims.config;

/**
 * Thrown when the versioned inference config cannot be read or fails validation.
 */
public class InferenceConfigException extends RuntimeException {

    private final String location;

    public InferenceConfigException(String location, String message) {
        super("Inference config at " + location + ": " + message);
        this.location = location;
    }

    public InferenceConfigException(String location, String message, Throwable cause) {
        super("Inference config at " + location + ": " + message, cause);
        this.location = location;
    }

    public String getLocation() {
        return location;
    }
}
