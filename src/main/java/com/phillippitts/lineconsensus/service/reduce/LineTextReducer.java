package com.phillippitts.lineconsensus.service.reduce;

import com.phillippitts.lineconsensus.domain.ConsensusRecord;
import com.phillippitts.lineconsensus.domain.FrameExtract;
import com.phillippitts.lineconsensus.domain.LineRecord;
import com.phillippitts.lineconsensus.domain.SubjectReduction;
import com.phillippitts.lineconsensus.domain.UserExtract;
import com.phillippitts.lineconsensus.exception.MalformedRecordException;
import com.phillippitts.lineconsensus.exception.ReductionExceptionBuilder;
import com.phillippitts.lineconsensus.service.reduce.event.SubjectReducedEvent;
import com.phillippitts.lineconsensus.service.reduce.event.SubjectReductionFailedEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Reduces all contributors' line-text extractions of one subject.
 *
 * <p>Observations are pooled per frame in input order. Contributor ids are mapped to user indices
 * in order of first appearance on the subject, so every frame of the subject shares the same
 * mapping. Each frame is reduced independently by the {@link FrameReducer}, with the density
 * threshold taken from the number of distinct contributors on the whole subject.
 *
 * <p><b>Error Handling:</b> a malformed record aborts the whole subject with a
 * {@link com.phillippitts.lineconsensus.exception.ReductionException} naming the subject and frame.
 * Nothing is kept between calls, so other subjects are unaffected.
 *
 * <p><b>Logging:</b> {@code subjectId} and {@code frame} are added to the Log4j2 ThreadContext while
 * the subject is reduced. A {@code projectId} already in the context is copied onto the events.
 */
@Service
public class LineTextReducer {

    private static final Logger LOG = LogManager.getLogger(LineTextReducer.class);

    static final String REASON_MALFORMED = "malformed_record";

    private final FrameReducer frameReducer;
    private final ApplicationEventPublisher publisher;
    private final ReductionMetricsPublisher metrics;

    /**
     * @param frameReducer per-frame consensus pipeline
     * @param publisher    application event publisher
     * @param metrics      metrics publisher ({@link ReductionMetricsPublisher#NOOP} in tests)
     * @throws NullPointerException if any argument is null
     */
    public LineTextReducer(FrameReducer frameReducer,
                           ApplicationEventPublisher publisher,
                           ReductionMetricsPublisher metrics) {
        this.frameReducer = Objects.requireNonNull(frameReducer, "frameReducer must not be null");
        this.publisher = Objects.requireNonNull(publisher, "publisher must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
    }

    /**
     * Reduces one subject.
     *
     * @param subjectId subject id (used in logs, events and errors)
     * @param extracts  one extraction per contributor classification
     * @return consensus records per frame, in first-seen frame order
     * @throws com.phillippitts.lineconsensus.exception.ReductionException if a record is malformed
     * @throws NullPointerException if an argument is null
     */
    public SubjectReduction reduce(String subjectId, List<UserExtract> extracts) {
        return reduce(subjectId, extracts, new AtomicBoolean());
    }

    /**
     * Reduces one subject on behalf of a caller that may give up on it.
     *
     * <p>{@code settled} is set by whichever side reports the subject first. This reducer sets it
     * before recording metrics or publishing events; if the caller has already set it (the subject
     * timed out), the remaining frames are skipped and nothing is reported.
     *
     * @param subjectId subject id (used in logs, events and errors)
     * @param extracts  one extraction per contributor classification
     * @param settled   shared report flag for this subject
     * @return consensus records per frame, in first-seen frame order
     * @throws com.phillippitts.lineconsensus.exception.ReductionException if a record is malformed
     * @throws CancellationException if the caller settled the subject first
     * @throws NullPointerException if an argument is null
     */
    public SubjectReduction reduce(String subjectId, List<UserExtract> extracts, AtomicBoolean settled) {
        Objects.requireNonNull(subjectId, "subjectId must not be null");
        Objects.requireNonNull(extracts, "extracts must not be null");
        Objects.requireNonNull(settled, "settled must not be null");

        long t0 = System.nanoTime();
        ThreadContext.put("subjectId", subjectId);
        try {
            SubjectPool subject = poolByFrame(extracts);
            Map<String, List<ConsensusRecord>> frames = new LinkedHashMap<>();
            List<FrameReduction> reductions = new ArrayList<>(subject.frames().size());
            for (Map.Entry<String, FramePool> entry : subject.frames().entrySet()) {
                if (settled.get()) {
                    throw abandoned(subjectId);
                }
                FrameReduction reduction = reduceFrame(subjectId, entry.getKey(), entry.getValue(),
                        subject.contributors(), settled);
                reductions.add(reduction);
                frames.put(entry.getKey(), reduction.consensus());
            }
            if (!settled.compareAndSet(false, true)) {
                throw abandoned(subjectId);
            }

            SubjectReduction result = new SubjectReduction(subjectId, frames);
            long elapsedNanos = System.nanoTime() - t0;
            long ms = elapsedNanos / 1_000_000L;
            reductions.forEach(metrics::recordFrame);
            metrics.recordSuccess(elapsedNanos);
            publisher.publishEvent(new SubjectReducedEvent(subjectId, ThreadContext.get("projectId"),
                    frames.size(), result.consensusCount(), ms, Instant.now()));
            LOG.info("Reduced subject: contributors={}, frames={}, consensusLines={}, durationMs={}",
                    subject.contributors(), frames.size(), result.consensusCount(), ms);
            return result;
        } finally {
            ThreadContext.remove("frame");
            ThreadContext.remove("subjectId");
        }
    }

    private FrameReduction reduceFrame(String subjectId, String frame, FramePool pool,
                                       int contributors, AtomicBoolean settled) {
        ThreadContext.put("frame", frame);
        try {
            return frameReducer.reduce(pool.records, pool.userIndices(), contributors);
        } catch (MalformedRecordException e) {
            if (!settled.compareAndSet(false, true)) {
                throw abandoned(subjectId);
            }
            LOG.warn("Malformed record in frame {}: {}", frame, e.getMessage());
            metrics.recordFailure(REASON_MALFORMED);
            publisher.publishEvent(new SubjectReductionFailedEvent(subjectId, ThreadContext.get("projectId"),
                    frame, REASON_MALFORMED, Instant.now()));
            throw ReductionExceptionBuilder.create("Subject reduction aborted")
                    .subject(subjectId)
                    .frame(frame)
                    .cause(e)
                    .metadata("field", e.getField())
                    .metadata("reason", e.getReason())
                    .build();
        }
    }

    private static CancellationException abandoned(String subjectId) {
        LOG.debug("Subject {} was settled by its caller; dropping the result", subjectId);
        return new CancellationException("Reduction of subject " + subjectId + " was abandoned");
    }

    private static SubjectPool poolByFrame(List<UserExtract> extracts) {
        Map<String, Integer> userIndex = new LinkedHashMap<>();
        Map<String, FramePool> pools = new LinkedHashMap<>();
        for (UserExtract extract : extracts) {
            Integer user = userIndex.get(extract.userId());
            if (user == null) {
                user = userIndex.size();
                userIndex.put(extract.userId(), user);
            }
            for (Map.Entry<String, FrameExtract> frame : extract.frames().entrySet()) {
                FramePool pool = pools.computeIfAbsent(frame.getKey(), k -> new FramePool());
                for (LineRecord line : frame.getValue().lines()) {
                    pool.add(line, user);
                }
            }
        }
        return new SubjectPool(pools, userIndex.size());
    }

    /**
     * Frames of one subject and the number of distinct contributors over all of them.
     */
    private record SubjectPool(Map<String, FramePool> frames, int contributors) {}

    /**
     * Observations of one frame pooled across contributors.
     */
    private static final class FramePool {
        private final List<LineRecord> records = new ArrayList<>();
        private final List<Integer> users = new ArrayList<>();

        void add(LineRecord record, int user) {
            records.add(record);
            users.add(user);
        }

        int[] userIndices() {
            return users.stream().mapToInt(Integer::intValue).toArray();
        }
    }
}
