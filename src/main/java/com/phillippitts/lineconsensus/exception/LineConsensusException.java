package com.phillippitts.lineconsensus.exception;

/**
 * Base exception for all line-consensus application errors.
 * All domain exceptions extend this class to enable centralized error handling.
 */
public class LineConsensusException extends RuntimeException {

    public LineConsensusException(String message) {
        super(message);
    }

    public LineConsensusException(String message, Throwable cause) {
        super(message, cause);
    }

    public LineConsensusException(Throwable cause) {
        super(cause);
    }
}
