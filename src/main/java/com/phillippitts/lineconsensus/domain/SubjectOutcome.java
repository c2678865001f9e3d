package com.phillippitts.lineconsensus.domain;

import java.util.Objects;

/**
 * Result of reducing one subject inside a batch: either a reduction or an error message.
 *
 * @param subjectId subject id
 * @param succeeded whether the reduction completed
 * @param reduction the reduction (null when failed)
 * @param error     failure description (null when succeeded)
 */
public record SubjectOutcome(
        String subjectId,
        boolean succeeded,
        SubjectReduction reduction,
        String error
) {

    public SubjectOutcome {
        Objects.requireNonNull(subjectId, "subjectId must not be null");
    }

    public static SubjectOutcome succeeded(SubjectReduction reduction) {
        return new SubjectOutcome(reduction.subjectId(), true, reduction, null);
    }

    public static SubjectOutcome failed(String subjectId, String error) {
        return new SubjectOutcome(subjectId, false, null, error);
    }
}
