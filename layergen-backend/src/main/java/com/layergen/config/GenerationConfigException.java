package com.layergen.config;

/**
 * The generation configuration is missing or invalid. Fatal to a run.
 */
public class GenerationConfigException extends RuntimeException {
    public GenerationConfigException(String message) {
        super(message);
    }

    public GenerationConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
