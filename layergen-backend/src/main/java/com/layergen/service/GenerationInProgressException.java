package com.layergen.service;

/**
 * A run was requested while another one is still active.
 */
public class GenerationInProgressException extends RuntimeException {
    public GenerationInProgressException(String message) {
        super(message);
    }
}
