package com.phillippitts.lineconsensus.exception;

/**
 * Thrown when a line record is read and a required field ({@code x}, {@code y} or
 * {@code text}) is missing or incomplete.
 */
public class MalformedRecordException extends LineConsensusException {

    private final String field;
    private final String reason;

    public MalformedRecordException(String field, String reason) {
        super("Malformed line record: field '" + field + "' " + reason);
        this.field = field;
        this.reason = reason;
    }

    public String getField() {
        return field;
    }

    public String getReason() {
        return reason;
    }
}
