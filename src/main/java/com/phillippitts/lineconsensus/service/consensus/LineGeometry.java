package com.phillippitts.lineconsensus.service.consensus;

import com.phillippitts.lineconsensus.domain.LineRecord.Point;

/**
 * Slope conventions shared by extraction and consensus building.
 */
public final class LineGeometry {

    private static final double ABSOLUTE_TOLERANCE = 0.01;
    private static final double RELATIVE_TOLERANCE = 1e-5;

    private LineGeometry() {
    }

    /**
     * Signed angle in degrees of the vector start→end, in [-180, 180].
     * Coincident endpoints give 0.
     */
    public static double slopeDegrees(Point start, Point end) {
        return Math.toDegrees(Math.atan2(end.y() - start.y(), end.x() - start.x()));
    }

    /**
     * Slope recorded by the extractor: 0 when the line is (nearly) vertical in x, i.e.
     * {@code |x1 - x2| <= 0.01 + 1e-5 * |x2|}, otherwise {@link #slopeDegrees(Point, Point)}.
     */
    public static double extractedSlopeDegrees(Point start, Point end) {
        double tolerance = ABSOLUTE_TOLERANCE + RELATIVE_TOLERANCE * Math.abs(end.x());
        if (Math.abs(start.x() - end.x()) <= tolerance) {
            return 0.0;
        }
        return slopeDegrees(start, end);
    }
}
