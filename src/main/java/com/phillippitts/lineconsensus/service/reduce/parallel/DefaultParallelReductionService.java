package com.phillippitts.lineconsensus.service.reduce.parallel;

import com.phillippitts.lineconsensus.config.properties.ReductionProperties;
import com.phillippitts.lineconsensus.domain.SubjectExtracts;
import com.phillippitts.lineconsensus.domain.SubjectOutcome;
import com.phillippitts.lineconsensus.exception.ReductionException;
import com.phillippitts.lineconsensus.service.reduce.LineTextReducer;
import com.phillippitts.lineconsensus.service.reduce.ReductionMetricsPublisher;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Default implementation of {@link ParallelReductionService}.
 *
 * <p><b>Thread Model:</b> each subject is one task on the bounded {@code reductionExecutor}.
 * The call blocks until every task finishes or the batch timeout expires; unfinished tasks are
 * then cancelled best-effort and reported as timed out.
 *
 * <p>Each subject carries a settle flag shared with {@link LineTextReducer}. Whichever side sets it
 * first reports the subject: a task still running past the timeout finds the flag set and drops
 * its result without recording success metrics or publishing events.
 *
 * <p><b>Error Handling:</b> a {@link ReductionException} (malformed input) or any unexpected
 * runtime error is logged and turned into a failed outcome for that subject only.
 */
@Service
public class DefaultParallelReductionService implements ParallelReductionService {

    private static final Logger LOG = LogManager.getLogger(DefaultParallelReductionService.class);

    static final String REASON_TIMEOUT = "timeout";
    static final String REASON_UNEXPECTED = "unexpected_error";

    private final LineTextReducer reducer;
    private final Executor executor;
    private final ReductionMetricsPublisher metrics;
    private final long defaultTimeoutMs;

    /**
     * @param reducer    subject reducer
     * @param executor   bounded pool for subject tasks (qualified as "reductionExecutor")
     * @param metrics    metrics publisher
     * @param properties reduction properties supplying the default batch timeout
     * @throws NullPointerException if any argument is null
     */
    public DefaultParallelReductionService(LineTextReducer reducer,
                                           @Qualifier("reductionExecutor") Executor executor,
                                           ReductionMetricsPublisher metrics,
                                           ReductionProperties properties) {
        this.reducer = Objects.requireNonNull(reducer, "reducer must not be null");
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
        this.defaultTimeoutMs = Objects.requireNonNull(properties, "properties must not be null").getTimeoutMs();
    }

    @Override
    public List<SubjectOutcome> reduceAll(List<SubjectExtracts> subjects, long timeoutMs) {
        Objects.requireNonNull(subjects, "subjects must not be null");
        final long toMs = timeoutMs > 0 ? timeoutMs : defaultTimeoutMs;

        List<CompletableFuture<SubjectOutcome>> futures = new ArrayList<>(subjects.size());
        List<AtomicBoolean> settled = new ArrayList<>(subjects.size());
        for (SubjectExtracts subject : subjects) {
            AtomicBoolean flag = new AtomicBoolean();
            settled.add(flag);
            futures.add(CompletableFuture.supplyAsync(() -> reduceOne(subject, flag), executor));
        }

        try {
            CompletableFuture.allOf(futures.toArray(CompletableFuture[]::new))
                    .get(toMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException te) {
            LOG.warn("Batch reduction timed out after {} ms", toMs);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while waiting for batch reduction");
        } catch (ExecutionException ee) {
            // reduceOne reports its own failures; collected per subject below
            LOG.debug("Batch completed with failures", ee);
        }

        List<SubjectOutcome> outcomes = new ArrayList<>(subjects.size());
        for (int i = 0; i < subjects.size(); i++) {
            outcomes.add(outcomeOf(futures.get(i), settled.get(i), subjects.get(i).subjectId(), toMs));
        }
        return outcomes;
    }

    private SubjectOutcome outcomeOf(CompletableFuture<SubjectOutcome> future, AtomicBoolean settled,
                                     String subjectId, long toMs) {
        if (!future.isDone() && settled.compareAndSet(false, true)) {
            future.cancel(true);
            metrics.recordFailure(REASON_TIMEOUT);
            return SubjectOutcome.failed(subjectId, "Reduction timed out after " + toMs + " ms");
        }
        // done, or the task claimed the subject and is finishing its report
        try {
            return future.join();
        } catch (CancellationException | CompletionException e) {
            LOG.error("Subject {} task ended abnormally", subjectId, e);
            metrics.recordFailure(REASON_UNEXPECTED);
            return SubjectOutcome.failed(subjectId, "Reduction failed unexpectedly");
        }
    }

    private SubjectOutcome reduceOne(SubjectExtracts subject, AtomicBoolean settled) {
        try {
            return SubjectOutcome.succeeded(reducer.reduce(subject.subjectId(), subject.extracts(), settled));
        } catch (ReductionException re) {
            LOG.warn("Subject {} failed: {}", subject.subjectId(), re.getMessage());
            return SubjectOutcome.failed(subject.subjectId(), re.getMessage());
        } catch (CancellationException ce) {
            return SubjectOutcome.failed(subject.subjectId(), ce.getMessage());
        } catch (RuntimeException e) {
            LOG.error("Subject {} unexpected error", subject.subjectId(), e);
            if (settled.compareAndSet(false, true)) {
                metrics.recordFailure(REASON_UNEXPECTED);
            }
            return SubjectOutcome.failed(subject.subjectId(),
                    "Unexpected error: " + e.getClass().getSimpleName());
        }
    }
}
