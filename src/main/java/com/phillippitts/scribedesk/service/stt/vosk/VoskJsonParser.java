package com.phillippitts.scribedesk.service.stt.vosk;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONObject;

import java.util.OptionalDouble;

/**
 * Utility to parse Vosk streaming JSON output.
 *
 * <p>This parser handles the two shapes a streaming recognizer produces:
 * <ul>
 *   <li><b>Partial:</b> {@code {"partial": "..."}}</li>
 *   <li><b>Final:</b> {@code {"text": "...", "result": [{"word": "...", "start": 0.1, "end": 0.4}, ...]}}</li>
 * </ul>
 *
 * <p>Thread-safe: All methods are static and stateless.
 *
 * <p><b>Security:</b> Protects against OOM attacks by capping JSON response size
 * at {@link #MAX_JSON_SIZE} (1MB).
 *
 * @since 1.0
 */
final class VoskJsonParser {

    private static final Logger LOG = LogManager.getLogger(VoskJsonParser.class);

    /**
     * Maximum allowed JSON response size from Vosk recognizer (1MB).
     */
    private static final int MAX_JSON_SIZE = 1_048_576; // 1MB

    private VoskJsonParser() {
        // Utility class - prevent instantiation
    }

    /**
     * Extracts the tentative text of a partial result.
     *
     * @param json JSON string from {@code Recognizer.getPartialResult()}
     * @return trimmed partial text, empty when absent or unparseable
     */
    static String parsePartial(String json) {
        JSONObject obj = parseObject(json);
        return obj == null ? "" : obj.optString("partial", "").trim();
    }

    /**
     * Extracts text and end time of a final result.
     *
     * <p>The end time is the {@code end} of the last word in {@code result}; it is absent when the
     * recognizer was not asked for word timings or recognized no words.
     *
     * @param json JSON string from {@code getResult()} or {@code getFinalResult()}
     * @return parsed final, with empty text when absent or unparseable
     */
    static VoskFinal parseFinal(String json) {
        JSONObject obj = parseObject(json);
        if (obj == null) {
            return new VoskFinal("", OptionalDouble.empty());
        }
        String text = obj.optString("text", "").trim();
        return new VoskFinal(text, lastWordEnd(obj));
    }

    private static OptionalDouble lastWordEnd(JSONObject obj) {
        JSONArray words = obj.optJSONArray("result");
        if (words == null || words.isEmpty()) {
            return OptionalDouble.empty();
        }
        JSONObject last = words.optJSONObject(words.length() - 1);
        if (last == null || !last.has("end")) {
            return OptionalDouble.empty();
        }
        double end = last.optDouble("end", Double.NaN);
        if (Double.isNaN(end) || end < 0.0) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(end);
    }

    private static JSONObject parseObject(String json) {
        if (json == null || json.isBlank()) {
            return null;
        }
        if (json.length() > MAX_JSON_SIZE) {
            LOG.warn("Vosk JSON response exceeds {}B cap (actual: {}B); ignoring", MAX_JSON_SIZE, json.length());
            return null;
        }
        try {
            return new JSONObject(json);
        } catch (Exception e) {
            LOG.warn("Failed to parse Vosk JSON response ({} chars)", json.length(), e);
            return null;
        }
    }

    /**
     * Parsed final result.
     *
     * @param text        recognized text (may be empty)
     * @param lastWordEnd offset in seconds of the last word's end, when word timings are present
     */
    record VoskFinal(String text, OptionalDouble lastWordEnd) {
    }
}
