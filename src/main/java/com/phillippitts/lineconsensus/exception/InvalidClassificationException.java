package com.phillippitts.lineconsensus.exception;

/**
 * Thrown when a raw classification payload cannot be turned into line records
 * (unparseable JSON, missing annotations, or a line without coordinates or text).
 */
public class InvalidClassificationException extends LineConsensusException {

    public InvalidClassificationException(String message) {
        super("Invalid classification: " + message);
    }

    public InvalidClassificationException(String message, Throwable cause) {
        super("Invalid classification: " + message, cause);
    }
}
