package com.phillippitts.lineconsensus.exception;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fluent builder for {@link ReductionException} with contextual metadata.
 *
 * <p><b>Usage:</b>
 * <pre>
 * throw ReductionExceptionBuilder.create("Subject reduction aborted")
 *         .subject("subject-42")
 *         .frame("frame0")
 *         .cause(malformed)
 *         .metadata("field", malformed.getField())
 *         .build();
 * </pre>
 *
 * <p>The final message format is
 * {@code {message} [k1=v1, k2=v2] (subject: {subject}, frame: {frame})}.
 */
public final class ReductionExceptionBuilder {

    private static final String UNKNOWN = "unknown";

    private final String message;
    private String subjectId;
    private String frame;
    private Throwable cause;
    private final Map<String, String> metadata = new LinkedHashMap<>();

    private ReductionExceptionBuilder(String message) {
        this.message = message;
    }

    /**
     * Creates a new builder with the base error message.
     *
     * @param message base error message (must not be null or empty)
     * @return new builder instance
     */
    public static ReductionExceptionBuilder create(String message) {
        if (message == null || message.isEmpty()) {
            throw new IllegalArgumentException("message must not be null or empty");
        }
        return new ReductionExceptionBuilder(message);
    }

    public ReductionExceptionBuilder subject(String subjectId) {
        this.subjectId = subjectId;
        return this;
    }

    public ReductionExceptionBuilder frame(String frame) {
        this.frame = frame;
        return this;
    }

    public ReductionExceptionBuilder cause(Throwable cause) {
        this.cause = cause;
        return this;
    }

    /**
     * Adds a metadata key-value pair to the exception message. Null keys or values are ignored.
     */
    public ReductionExceptionBuilder metadata(String key, Object value) {
        if (key != null && value != null) {
            this.metadata.put(key, String.valueOf(value));
        }
        return this;
    }

    public ReductionException build() {
        String detailed = buildDetailedMessage();
        String subject = subjectId != null ? subjectId : UNKNOWN;
        String frameName = frame != null ? frame : UNKNOWN;
        if (cause != null) {
            return new ReductionException(detailed, subject, frameName, cause);
        }
        return new ReductionException(detailed, subject, frameName);
    }

    private String buildDetailedMessage() {
        if (metadata.isEmpty()) {
            return message;
        }
        StringBuilder sb = new StringBuilder(message).append(" [");
        boolean first = true;
        for (Map.Entry<String, String> entry : metadata.entrySet()) {
            if (!first) {
                sb.append(", ");
            }
            sb.append(entry.getKey()).append('=').append(entry.getValue());
            first = false;
        }
        return sb.append(']').toString();
    }
}
