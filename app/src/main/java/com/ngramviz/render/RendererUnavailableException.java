package com.ngramviz.render;

/**
 * Thrown when scatter output is requested but the scatter renderer cannot be engaged.
 */
public class RendererUnavailableException extends Exception {
    
    public RendererUnavailableException(String message) {
        super(message);
    }
    
    public RendererUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
