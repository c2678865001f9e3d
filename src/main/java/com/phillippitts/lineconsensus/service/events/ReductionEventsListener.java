package com.phillippitts.lineconsensus.service.events;

import com.phillippitts.lineconsensus.service.reduce.event.SubjectReducedEvent;
import com.phillippitts.lineconsensus.service.reduce.event.SubjectReductionFailedEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Central log sink for reduction events. Failure warnings are throttled per project and reason so
 * a batch of broken payloads does not flood the log.
 */
@Component
class ReductionEventsListener {
    private static final Logger LOG = LogManager.getLogger(ReductionEventsListener.class);

    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();
    private static final Duration THROTTLE = Duration.ofMinutes(1);
    private static final String NO_PROJECT = "-";

    @EventListener
    void onSubjectReduced(SubjectReducedEvent e) {
        LOG.debug("Subject {} reduced: project={}, frames={}, consensusLines={}, durationMs={}",
                e.subjectId(), projectOf(e.projectId()), e.frameCount(), e.consensusCount(), e.durationMs());
    }

    @EventListener
    void onSubjectReductionFailed(SubjectReductionFailedEvent e) {
        String project = projectOf(e.projectId());
        if (shouldLog("reduction-failed-" + project + "-" + e.reason())) {
            LOG.warn("Subject reduction failed: project={}, subject={}, frame={}, reason={}. "
                    + "Check the extraction payloads of this subject.", project, e.subjectId(), e.frame(), e.reason());
        }
    }

    private static String projectOf(String projectId) {
        return projectId == null ? NO_PROJECT : projectId;
    }

    // Package-private for tests
    boolean shouldLog(String key) {
        Instant now = Instant.now();
        Instant prev = lastLog.get(key);
        if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
            lastLog.put(key, now);
            return true;
        }
        return false;
    }
}
