package com.phillippitts.streamscribe.service.upstream.deepgram;

import com.phillippitts.streamscribe.domain.TranscriptFragment;
import com.phillippitts.streamscribe.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.time.Instant;

/**
 * Parses Deepgram live-streaming JSON messages.
 *
 * <p>Handles these message shapes:
 * <ul>
 *   <li><b>Results:</b> {@code {"type":"Results","is_final":true,"channel":{"alternatives":[{"transcript":"...","words":[{"speaker":0}]}]}}}</li>
 *   <li><b>Errors:</b> {@code {"type":"Error","description":"..."}} or {@code {"err_code":"...","err_msg":"..."}}</li>
 *   <li><b>Everything else</b> (Metadata, SpeechStarted, UtteranceEnd) is ignored.</li>
 * </ul>
 *
 * <p>The speaker label is read from the alternative itself when present, otherwise from
 * its first word (diarized results attach speakers per word).
 *
 * <p>Thread-safe: All methods are static and stateless.
 */
final class DeepgramEventParser {

    private static final Logger LOG = LogManager.getLogger(DeepgramEventParser.class);

    /** Guard against unbounded provider messages. */
    private static final int MAX_JSON_SIZE = 1_048_576; // 1MB

    private DeepgramEventParser() {
        // Utility class - prevent instantiation
    }

    /**
     * Parses one text frame.
     *
     * @param json      frame payload
     * @param arrivedAt receive timestamp stamped on transcript fragments
     * @return parsed event; never null
     */
    static ProviderEvent parse(String json, Instant arrivedAt) {
        if (json == null || json.isBlank()) {
            return new ProviderEvent.Ignored("empty");
        }
        if (json.length() > MAX_JSON_SIZE) {
            LOG.warn("Provider message exceeds {}B cap (actual: {}B); ignoring", MAX_JSON_SIZE, json.length());
            return new ProviderEvent.Ignored("oversized");
        }
        try {
            JSONObject obj = new JSONObject(json);
            if (obj.has("err_code") || obj.has("err_msg")) {
                return new ProviderEvent.ProviderError(obj.optString("err_code", "error")
                        + ": " + obj.optString("err_msg", ""));
            }
            String type = obj.optString("type", "Results");
            if ("Error".equalsIgnoreCase(type)) {
                String description = obj.optString("description", obj.optString("message", "unknown provider error"));
                return new ProviderEvent.ProviderError(description);
            }
            if (!"Results".equals(type)) {
                return new ProviderEvent.Ignored(type);
            }
            return parseResults(obj, arrivedAt);
        } catch (JSONException e) {
            LOG.warn("Failed to parse provider message: {}", LogSanitizer.truncate(json, 200), e);
            return new ProviderEvent.Ignored("malformed");
        }
    }

    private static ProviderEvent parseResults(JSONObject obj, Instant arrivedAt) {
        JSONObject channel = obj.optJSONObject("channel");
        if (channel == null) {
            return new ProviderEvent.Ignored("Results");
        }
        JSONArray alternatives = channel.optJSONArray("alternatives");
        if (alternatives == null || alternatives.isEmpty()) {
            return new ProviderEvent.Ignored("Results");
        }
        JSONObject first = alternatives.getJSONObject(0);
        String text = first.optString("transcript", "").trim();
        if (text.isEmpty()) {
            return new ProviderEvent.Ignored("Results");
        }
        boolean isFinal = obj.optBoolean("is_final", false);
        Integer speaker = extractSpeaker(first);
        return new ProviderEvent.Transcript(new TranscriptFragment(text, speaker, isFinal, arrivedAt));
    }

    private static Integer extractSpeaker(JSONObject alternative) {
        if (alternative.has("speaker") && !alternative.isNull("speaker")) {
            int speaker = alternative.optInt("speaker", -1);
            return speaker >= 0 ? speaker : null;
        }
        JSONArray words = alternative.optJSONArray("words");
        if (words == null || words.isEmpty()) {
            return null;
        }
        JSONObject word = words.optJSONObject(0);
        if (word == null || !word.has("speaker") || word.isNull("speaker")) {
            return null;
        }
        int speaker = word.optInt("speaker", -1);
        return speaker >= 0 ? speaker : null;
    }
}
