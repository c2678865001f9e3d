package com.phillippitts.lineconsensus.presentation.controller;

import com.phillippitts.lineconsensus.domain.ClassificationExtract;
import com.phillippitts.lineconsensus.domain.SubjectExtracts;
import com.phillippitts.lineconsensus.domain.SubjectOutcome;
import com.phillippitts.lineconsensus.domain.SubjectReduction;
import com.phillippitts.lineconsensus.service.extract.LineTextExtractor;
import com.phillippitts.lineconsensus.service.reduce.LineTextReducer;
import com.phillippitts.lineconsensus.service.reduce.parallel.ParallelReductionService;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * HTTP surface of the extract and reduce stages.
 *
 * <ul>
 *   <li>{@code POST /extractors/line-text}: raw classification JSON to per-frame lines</li>
 *   <li>{@code POST /reducers/line-text}: one subject's extracts to consensus lines</li>
 *   <li>{@code POST /reducers/line-text/batch}: many subjects, reduced in parallel</li>
 * </ul>
 */
@RestController
class ReductionController {

    private static final Logger LOG = LogManager.getLogger(ReductionController.class);

    private final LineTextExtractor extractor;
    private final LineTextReducer reducer;
    private final ParallelReductionService parallelReducer;

    ReductionController(LineTextExtractor extractor,
                        LineTextReducer reducer,
                        ParallelReductionService parallelReducer) {
        this.extractor = extractor;
        this.reducer = reducer;
        this.parallelReducer = parallelReducer;
    }

    @PostMapping(path = "/extractors/line-text", consumes = MediaType.APPLICATION_JSON_VALUE)
    ResponseEntity<ClassificationExtract> extract(@RequestBody String classification) {
        ClassificationExtract extract = extractor.extract(classification);
        LOG.debug("Extracted {} frame(s)", extract.frames().size());
        return ResponseEntity.ok(extract);
    }

    @PostMapping(path = "/reducers/line-text", consumes = MediaType.APPLICATION_JSON_VALUE)
    ResponseEntity<SubjectReduction> reduce(@RequestBody SubjectExtracts subject) {
        return ResponseEntity.ok(reducer.reduce(subject.subjectId(), subject.extracts()));
    }

    @PostMapping(path = "/reducers/line-text/batch", consumes = MediaType.APPLICATION_JSON_VALUE)
    ResponseEntity<List<SubjectOutcome>> reduceBatch(@RequestBody List<SubjectExtracts> subjects,
                                                     @RequestParam(defaultValue = "0") long timeoutMs) {
        LOG.info("Batch reduction requested for {} subject(s)", subjects.size());
        return ResponseEntity.ok(parallelReducer.reduceAll(subjects, timeoutMs));
    }
}
