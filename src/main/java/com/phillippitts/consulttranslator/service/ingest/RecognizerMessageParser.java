package com.phillippitts.consulttranslator.service.ingest;

import com.phillippitts.consulttranslator.domain.Token;
import com.phillippitts.consulttranslator.domain.TranslationStatus;
import com.phillippitts.consulttranslator.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses streaming recognizer result JSON into {@link Token}s.
 *
 * <p>Handled shapes:
 * <ul>
 *   <li><b>Result:</b> {@code {"tokens": [...], "finished": false}}</li>
 *   <li><b>Wrapped response:</b> {@code {"message_type": "response", "response": {"tokens": [...]}}}</li>
 *   <li><b>Error:</b> {@code {"error_code": 400, "error_message": "..."}}</li>
 * </ul>
 *
 * <p>Token fields accept the aliases different recognizer versions emit: {@code text}/{@code utterance},
 * {@code speaker}/{@code speaker_id}, {@code language}/{@code detected_language}, and either
 * {@code translation_status} or the boolean {@code translated}/{@code is_translation} flags.
 *
 * <p>Never throws: malformed input degrades to an empty message and tokens without string text
 * are skipped, because the recognizer feed is noisy and must not break a session.
 *
 * <p>Thread-safe: all methods are static and stateless.
 *
 * @since 1.0
 */
public final class RecognizerMessageParser {

    private static final Logger LOG = LogManager.getLogger(RecognizerMessageParser.class);

    /**
     * Maximum accepted message size (1MB). Larger messages are rejected rather than parsed.
     */
    static final int MAX_MESSAGE_SIZE = 1_048_576;

    private RecognizerMessageParser() {
        // Utility class - prevent instantiation
    }

    /**
     * Parses one recognizer message.
     *
     * @param json raw message text (may be null)
     * @return parsed message, never null
     */
    public static RecognizerMessage parse(String json) {
        if (json == null || json.isBlank()) {
            return RecognizerMessage.empty();
        }
        if (json.length() > MAX_MESSAGE_SIZE) {
            LOG.warn("Recognizer message exceeds {}B cap (actual: {}B); ignoring", MAX_MESSAGE_SIZE, json.length());
            return RecognizerMessage.empty();
        }
        try {
            return parse(new JSONObject(json));
        } catch (JSONException e) {
            LOG.warn("Failed to parse recognizer message: {}", LogSanitizer.preview(json, 200), e);
            return RecognizerMessage.empty();
        }
    }

    /**
     * Parses an already decoded recognizer message.
     */
    public static RecognizerMessage parse(JSONObject obj) {
        if (obj.has("error_code") && !obj.isNull("error_code")) {
            return RecognizerMessage.error(
                    String.valueOf(obj.get("error_code")),
                    obj.optString("error_message", "unknown"));
        }

        JSONArray rawTokens = tokenArray(obj);
        List<Token> tokens = new ArrayList<>();
        if (rawTokens != null) {
            for (int i = 0; i < rawTokens.length(); i++) {
                JSONObject rawToken = rawTokens.optJSONObject(i);
                if (rawToken == null) {
                    continue;
                }
                Token token = toToken(rawToken);
                if (token != null) {
                    tokens.add(token);
                }
            }
        }
        return new RecognizerMessage(tokens, null, null, obj.optBoolean("finished", false));
    }

    private static JSONArray tokenArray(JSONObject obj) {
        if ("response".equals(obj.optString("message_type"))) {
            JSONObject response = obj.optJSONObject("response");
            return response == null ? null : response.optJSONArray("tokens");
        }
        return obj.optJSONArray("tokens");
    }

    /**
     * Converts one raw token, or returns null when it carries no string text.
     */
    static Token toToken(JSONObject raw) {
        Object text = raw.has("text") ? raw.opt("text") : raw.opt("utterance");
        if (!(text instanceof String textValue) || textValue.isEmpty()) {
            return null;
        }
        return new Token(
                textValue,
                speakerHint(raw),
                firstString(raw, "language", "detected_language"),
                raw.optBoolean("is_final", false),
                firstString(raw, "timestamp"),
                translationStatus(raw),
                firstString(raw, "source_language"));
    }

    private static String speakerHint(JSONObject raw) {
        Object speaker = raw.has("speaker") ? raw.opt("speaker") : raw.opt("speaker_id");
        if (speaker == null || speaker == JSONObject.NULL) {
            return null;
        }
        return String.valueOf(speaker);
    }

    private static TranslationStatus translationStatus(JSONObject raw) {
        if (raw.optBoolean("translated", false) || raw.optBoolean("is_translation", false)) {
            return TranslationStatus.TRANSLATION;
        }
        return TranslationStatus.fromWire(firstString(raw, "translation_status"));
    }

    private static String firstString(JSONObject raw, String... keys) {
        for (String key : keys) {
            Object value = raw.opt(key);
            if (value instanceof String s && !s.isBlank()) {
                return s;
            }
        }
        return null;
    }
}
