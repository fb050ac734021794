package com.structural.connector.connect.model;

/**
 * A line references a node that does not exist. The connection pass is
 * aborted; no partial result is produced.
 */
public class ModelIntegrityException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public ModelIntegrityException(String message) {
        super(message);
    }
}
