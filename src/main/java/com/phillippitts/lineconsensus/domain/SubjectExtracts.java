package com.phillippitts.lineconsensus.domain;

import java.util.List;
import java.util.Objects;

/**
 * All contributors' extractions of one subject, ready for reduction.
 */
public record SubjectExtracts(String subjectId, List<UserExtract> extracts) {

    public SubjectExtracts {
        Objects.requireNonNull(subjectId, "subjectId must not be null");
        extracts = extracts == null ? List.of() : List.copyOf(extracts);
    }
}
