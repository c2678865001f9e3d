package com.phillippitts.lineconsensus.service.reduce.event;

import java.time.Instant;

/**
 * Emitted when a subject has been reduced.
 *
 * @param subjectId      subject id
 * @param projectId      crowd project the request named, or null when none was sent
 * @param frameCount     number of frames reduced
 * @param consensusCount number of consensus lines produced over all frames
 * @param durationMs     reduction time in milliseconds
 * @param timestamp      when the reduction completed
 */
public record SubjectReducedEvent(
        String subjectId,
        String projectId,
        int frameCount,
        int consensusCount,
        long durationMs,
        Instant timestamp
) {}
