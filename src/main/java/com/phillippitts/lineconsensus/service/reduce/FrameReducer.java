package com.phillippitts.lineconsensus.service.reduce;

import com.phillippitts.lineconsensus.domain.LineRecord;

import java.util.Arrays;
import java.util.List;

/**
 * Reduces the observations of one frame of one subject into consensus records.
 *
 * <p>Implementations hold no state between calls, so frames and subjects may be reduced on
 * parallel workers without coordination.
 */
public interface FrameReducer {

    /**
     * @param records      the frame's line records in input order
     * @param userIndices  contributor index per record (same length as records)
     * @param contributors distinct contributors on the whole subject, including those who drew
     *                     nothing on this frame; drives the density threshold
     * @return consensus records and the grouping that produced them
     * @throws com.phillippitts.lineconsensus.exception.MalformedRecordException if a record lacks a field
     * @throws IllegalArgumentException if the inputs differ in length, or contributors is fewer
     *                                  than the distinct users present on the frame
     */
    FrameReduction reduce(List<LineRecord> records, int[] userIndices, int contributors);

    /**
     * Reduces a frame that is the whole subject: the contributor count is taken from the frame.
     */
    default FrameReduction reduce(List<LineRecord> records, int[] userIndices) {
        return reduce(records, userIndices, (int) Arrays.stream(userIndices).distinct().count());
    }
}
