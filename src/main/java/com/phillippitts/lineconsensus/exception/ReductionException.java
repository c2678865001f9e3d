package com.phillippitts.lineconsensus.exception;

/**
 * Thrown when the reduction of a subject aborts.
 * The failure is confined to that subject; other subjects in the same batch are unaffected.
 */
public class ReductionException extends LineConsensusException {

    private static final String UNKNOWN = "unknown";

    private final String subjectId;
    private final String frame;

    public ReductionException(String message) {
        super(message);
        this.subjectId = UNKNOWN;
        this.frame = UNKNOWN;
    }

    public ReductionException(String message, String subjectId, String frame) {
        super(message + " (subject: " + subjectId + ", frame: " + frame + ")");
        this.subjectId = subjectId;
        this.frame = frame;
    }

    public ReductionException(String message, String subjectId, String frame, Throwable cause) {
        super(message + " (subject: " + subjectId + ", frame: " + frame + ")", cause);
        this.subjectId = subjectId;
        this.frame = frame;
    }

    public String getSubjectId() {
        return subjectId;
    }

    public String getFrame() {
        return frame;
    }
}
