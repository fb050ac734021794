package com.structural.connector.io;

/**
 * An export or solver document cannot be read.
 */
public class ModelParseException extends Exception {

    private static final long serialVersionUID = 1L;

    public ModelParseException(String message) {
        super(message);
    }

    public ModelParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
