package com.phillippitts.lineconsensus.service.reduce.parallel;

import com.phillippitts.lineconsensus.domain.SubjectExtracts;
import com.phillippitts.lineconsensus.domain.SubjectOutcome;

import java.util.List;

/**
 * Reduces a batch of subjects concurrently. Every subject is isolated: a failing or timed-out
 * subject yields a failed {@link SubjectOutcome} and never affects the others.
 */
public interface ParallelReductionService {

    /**
     * @param subjects  subjects to reduce
     * @param timeoutMs time budget for the whole batch (0 or less for the configured default)
     * @return one outcome per subject, in input order
     */
    List<SubjectOutcome> reduceAll(List<SubjectExtracts> subjects, long timeoutMs);
}
