package com.phillippitts.lineconsensus.service.extract;

import com.phillippitts.lineconsensus.domain.ClassificationExtract;
import com.phillippitts.lineconsensus.domain.FrameExtract;
import com.phillippitts.lineconsensus.domain.LineRecord;
import com.phillippitts.lineconsensus.exception.InvalidClassificationException;
import com.phillippitts.lineconsensus.service.consensus.LineGeometry;
import com.phillippitts.lineconsensus.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Extracts line-tool annotations with a text sub-task from a raw classification.
 *
 * <p>Expected payload:
 * <pre>{@code
 * {"annotations": [{"value": [
 *     {"frame": 0, "x1": 10, "y1": 20, "x2": 200, "y2": 22,
 *      "details": [{"value": "the transcribed line"}]}
 * ]}]}
 * }</pre>
 *
 * <p>Only the first annotation is read. Lines are grouped under {@code "frame<N>"} keys in
 * first-seen order; each line also gets its extraction slope
 * ({@link LineGeometry#extractedSlopeDegrees}).
 *
 * <p>A malformed payload is rejected as a whole with {@link InvalidClassificationException};
 * no line is dropped silently.
 */
@Component
public class LineTextExtractor {

    private static final Logger LOG = LogManager.getLogger(LineTextExtractor.class);
    private static final int TEXT_PREVIEW = 40;

    /**
     * @param classificationJson raw classification JSON
     * @return lines and slopes grouped by frame
     * @throws InvalidClassificationException if the payload cannot be extracted
     */
    public ClassificationExtract extract(String classificationJson) {
        if (classificationJson == null || classificationJson.isBlank()) {
            throw new InvalidClassificationException("empty payload");
        }
        JSONArray values;
        try {
            JSONObject classification = new JSONObject(classificationJson);
            JSONArray annotations = classification.getJSONArray("annotations");
            if (annotations.isEmpty()) {
                throw new InvalidClassificationException("no annotations");
            }
            values = annotations.getJSONObject(0).getJSONArray("value");
        } catch (JSONException e) {
            throw new InvalidClassificationException(e.getMessage(), e);
        }

        Map<String, List<LineRecord>> lines = new LinkedHashMap<>();
        Map<String, List<Double>> slopes = new LinkedHashMap<>();
        for (int i = 0; i < values.length(); i++) {
            JSONObject value = values.optJSONObject(i);
            if (value == null) {
                throw new InvalidClassificationException("line " + i + " is not an object");
            }
            String frame;
            LineRecord line;
            try {
                frame = "frame" + value.getInt("frame");
                String text = value.getJSONArray("details").getJSONObject(0).getString("value");
                line = LineRecord.of(value.getDouble("x1"), value.getDouble("y1"),
                        value.getDouble("x2"), value.getDouble("y2"), text);
            } catch (JSONException e) {
                throw new InvalidClassificationException("line " + i + ": " + e.getMessage(), e);
            }
            lines.computeIfAbsent(frame, k -> new ArrayList<>()).add(line);
            slopes.computeIfAbsent(frame, k -> new ArrayList<>())
                    .add(LineGeometry.extractedSlopeDegrees(line.start(), line.end()));
            LOG.debug("Extracted line {} on {}: '{}'", i, frame, LogSanitizer.preview(line.rawText(), TEXT_PREVIEW));
        }

        Map<String, FrameExtract> frames = new LinkedHashMap<>();
        lines.forEach((frame, frameLines) -> frames.put(frame, new FrameExtract(frameLines, slopes.get(frame))));
        return new ClassificationExtract(frames);
    }
}
