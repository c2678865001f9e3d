package com.phillippitts.lineconsensus.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Extraction of one classification, keyed by frame ({@code "frame0"}, {@code "frame1"}, ...)
 * in first-seen order.
 */
public record ClassificationExtract(Map<String, FrameExtract> frames) {

    public ClassificationExtract {
        frames = frames == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(frames));
    }
}
