package com.phillippitts.lineconsensus.domain;

/**
 * Identifies one submission and the contributor who made it.
 *
 * @param dataIndex position of the {@link LineRecord} in the frame's ordered record list (unique)
 * @param userIndex contributor index, shared by every observation of the same contributor
 */
public record ObservationKey(int dataIndex, int userIndex) {

    public ObservationKey {
        if (dataIndex < 0) {
            throw new IllegalArgumentException("dataIndex must be >= 0, got: " + dataIndex);
        }
    }
}
