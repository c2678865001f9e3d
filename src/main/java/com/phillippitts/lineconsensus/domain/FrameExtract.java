package com.phillippitts.lineconsensus.domain;

import java.util.List;

/**
 * Lines one contributor drew on a single frame, with the slope computed at extraction time.
 *
 * @param lines  ordered line records
 * @param slopes slope in degrees of each line (parallel to {@code lines}; may be empty when
 *               the extract was built by hand)
 */
public record FrameExtract(List<LineRecord> lines, List<Double> slopes) {

    public FrameExtract {
        lines = lines == null ? List.of() : List.copyOf(lines);
        slopes = slopes == null ? List.of() : List.copyOf(slopes);
    }
}
