package com.phillippitts.lineconsensus.domain;

import com.phillippitts.lineconsensus.exception.MalformedRecordException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One submitted annotation of a text line: a drawn segment plus its transcription.
 *
 * <p>The shape follows the extraction layer's output:
 * {@code {x: [x_start, x_end], y: [y_start, y_end], text: [raw_string]}}. Records are not
 * validated on construction; a missing or short field fails with
 * {@link MalformedRecordException} at the point it is read, so one bad record aborts only the
 * reduction that touches it.
 *
 * @param x    start and end x coordinates (may be null if the payload omitted it)
 * @param y    start and end y coordinates (may be null if the payload omitted it)
 * @param text single-element list holding the raw transcription (may be null)
 */
public record LineRecord(
        List<Double> x,
        List<Double> y,
        List<String> text
) {

    public LineRecord {
        x = x == null ? null : Collections.unmodifiableList(new ArrayList<>(x));
        y = y == null ? null : Collections.unmodifiableList(new ArrayList<>(y));
        text = text == null ? null : Collections.unmodifiableList(new ArrayList<>(text));
    }

    /**
     * Creates a well-formed record from explicit endpoints and text.
     */
    public static LineRecord of(double x1, double y1, double x2, double y2, String text) {
        return new LineRecord(List.of(x1, x2), List.of(y1, y2), List.of(text));
    }

    /**
     * Returns the start endpoint of the drawn line.
     *
     * @throws MalformedRecordException if {@code x} or {@code y} is missing or has fewer than two values
     */
    public Point start() {
        return new Point(coordinate(x, "x", 0), coordinate(y, "y", 0));
    }

    /**
     * Returns the end endpoint of the drawn line (the last coordinate pair).
     *
     * @throws MalformedRecordException if {@code x} or {@code y} is missing or has fewer than two values
     */
    public Point end() {
        return new Point(coordinate(x, "x", lastIndex(x, "x")), coordinate(y, "y", lastIndex(y, "y")));
    }

    /**
     * Returns the raw, un-normalized transcription.
     *
     * @throws MalformedRecordException if {@code text} is missing or empty
     */
    public String rawText() {
        if (text == null || text.isEmpty() || text.get(0) == null) {
            throw new MalformedRecordException("text", "missing transcription");
        }
        return text.get(0);
    }

    private static int lastIndex(List<Double> values, String field) {
        if (values == null || values.size() < 2) {
            throw new MalformedRecordException(field, "expected start and end coordinates");
        }
        return values.size() - 1;
    }

    private static double coordinate(List<Double> values, String field, int index) {
        if (values == null || values.size() < 2) {
            throw new MalformedRecordException(field, "expected start and end coordinates");
        }
        Double value = values.get(index);
        if (value == null) {
            throw new MalformedRecordException(field, "null coordinate at position " + index);
        }
        return value;
    }

    /**
     * A single endpoint of a drawn line.
     */
    public record Point(double x, double y) {

        public double distanceTo(Point other) {
            return Math.hypot(x - other.x, y - other.y);
        }
    }
}
