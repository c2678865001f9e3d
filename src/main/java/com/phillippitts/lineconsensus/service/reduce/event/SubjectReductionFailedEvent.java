package com.phillippitts.lineconsensus.service.reduce.event;

import java.time.Instant;

/**
 * Emitted when the reduction of a subject aborts.
 *
 * @param subjectId subject id
 * @param projectId crowd project the request named, or null when none was sent
 * @param frame     frame being reduced when the failure happened
 * @param reason    failure category (e.g. malformed_record)
 * @param timestamp when the failure happened
 */
public record SubjectReductionFailedEvent(
        String subjectId,
        String projectId,
        String frame,
        String reason,
        Instant timestamp
) {}
