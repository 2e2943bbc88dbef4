package com.openforge.taskcore.extraction;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.regex.Pattern;

/**
 * Pulls the first JSON object out of a model response and parses it.
 *
 * Models wrap JSON in prose or markdown fences, and sometimes truncate or
 * loosen it. Strict parsing is tried first; on failure exactly one repair pass runs:
 * quote bare property names, drop trailing commas, close open strings,
 * brackets and braces.
 */
@Slf4j
@Component
public class JsonObjectExtractor {

    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private static final Pattern CODE_FENCE = Pattern.compile("```(?:json|JSON)?");

    private final ObjectMapper objectMapper;

    public JsonObjectExtractor(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public JsonParseOutcome parse(String responseText) {
        if (responseText == null) {
            return JsonParseOutcome.failed(JsonParseOutcome.ParseFault.NO_JSON_OBJECT);
        }
        String body = CODE_FENCE.matcher(responseText).replaceAll("");

        // prose may contain braces of its own; move past candidates that do not parse
        JsonParseOutcome firstFailure = null;
        int start = body.indexOf('{');
        while (start >= 0) {
            String candidate = objectAt(body, start);
            JsonParseOutcome outcome = parseCandidate(candidate);
            if (outcome.isParsed()) return outcome;
            if (firstFailure == null) firstFailure = outcome;
            start = body.indexOf('{', start + candidate.length());
        }

        if (firstFailure == null) {
            return JsonParseOutcome.failed(JsonParseOutcome.ParseFault.NO_JSON_OBJECT);
        }
        log.warn("[Extractor] No parsable JSON object in model output ({})", firstFailure.fault());
        return firstFailure;
    }

    private JsonParseOutcome parseCandidate(String candidate) {
        try {
            return toOutcome(objectMapper.readTree(candidate), false);
        } catch (JsonProcessingException strictError) {
            String repaired = repair(candidate);
            try {
                JsonParseOutcome outcome = toOutcome(objectMapper.readTree(repaired), true);
                log.debug("[Extractor] Model JSON needed repair ({} → {} chars)", candidate.length(), repaired.length());
                return outcome;
            } catch (JsonProcessingException repairError) {
                log.debug("[Extractor] Candidate unparsable after repair: {}", repairError.getOriginalMessage());
                return JsonParseOutcome.failed(JsonParseOutcome.ParseFault.MALFORMED_JSON);
            }
        }
    }

    private JsonParseOutcome toOutcome(JsonNode node, boolean repaired) {
        if (node == null || !node.isObject()) {
            return JsonParseOutcome.failed(JsonParseOutcome.ParseFault.NOT_AN_OBJECT);
        }
        return JsonParseOutcome.parsed(objectMapper.convertValue(node, MAP_TYPE), repaired);
    }

    // ── Scanning ─────────────────────────────────────────────────────────────

    /**
     * Substring from the first '{' to its matching '}' (string literals honoured).
     * An object that never closes is returned up to the end of the text so the
     * repair pass can close it. Null when there is no '{' at all.
     */
    static String firstObject(String text) {
        if (text == null) return null;
        String body = CODE_FENCE.matcher(text).replaceAll("");
        int start = body.indexOf('{');
        return start < 0 ? null : objectAt(body, start);
    }

    private static String objectAt(String body, int start) {
        int depth = 0;
        boolean inString = false;
        boolean escaped  = false;
        for (int i = start; i < body.length(); i++) {
            char c = body.charAt(i);
            if (inString) {
                if (escaped)        escaped = false;
                else if (c == '\\') escaped = true;
                else if (c == '"')  inString = false;
                continue;
            }
            if (c == '"') inString = true;
            else if (c == '{') depth++;
            else if (c == '}' && --depth == 0) return body.substring(start, i + 1);
        }
        return body.substring(start).trim();
    }

    /** Single deterministic pass; see class doc. String contents are never touched. */
    static String repair(String json) {
        StringBuilder out = new StringBuilder(json.length() + 16);
        Deque<Character> open = new ArrayDeque<>();
        boolean inString = false;
        boolean escaped  = false;

        int i = 0;
        while (i < json.length()) {
            char c = json.charAt(i);

            if (inString) {
                out.append(c);
                if (escaped)        escaped = false;
                else if (c == '\\') escaped = true;
                else if (c == '"')  inString = false;
                i++;
                continue;
            }

            if (c == '"') {
                inString = true;
                out.append(c);
                i++;
            } else if (c == '{' || c == '[') {
                open.push(c == '{' ? '}' : ']');
                out.append(c);
                i++;
            } else if (c == '}' || c == ']') {
                stripTrailingComma(out);
                if (!open.isEmpty()) open.pop();
                out.append(c);
                i++;
            } else if (isIdentifierStart(c) && expectsKey(out, open)) {
                int end = i + 1;
                while (end < json.length() && isIdentifierPart(json.charAt(end))) end++;
                int colon = end;
                while (colon < json.length() && Character.isWhitespace(json.charAt(colon))) colon++;
                if (colon < json.length() && json.charAt(colon) == ':') {
                    out.append('"').append(json, i, end).append('"');
                } else {
                    out.append(json, i, end);
                }
                i = end;
            } else {
                out.append(c);
                i++;
            }
        }

        if (inString) out.append('"');
        stripTrailingComma(out);
        while (!open.isEmpty()) {
            out.append(open.pop());
        }
        return out.toString();
    }

    private static boolean expectsKey(StringBuilder out, Deque<Character> open) {
        if (open.isEmpty() || open.peek() != '}') return false;
        char prev = lastSignificant(out);
        return prev == '{' || prev == ',';
    }

    private static char lastSignificant(StringBuilder out) {
        for (int k = out.length() - 1; k >= 0; k--) {
            char c = out.charAt(k);
            if (!Character.isWhitespace(c)) return c;
        }
        return 0;
    }

    private static void stripTrailingComma(StringBuilder out) {
        int k = out.length() - 1;
        while (k >= 0 && Character.isWhitespace(out.charAt(k))) k--;
        if (k >= 0 && out.charAt(k) == ',') {
            out.setLength(k);
        }
    }

    private static boolean isIdentifierStart(char c) {
        return Character.isLetter(c) || c == '_' || c == '$';
    }

    private static boolean isIdentifierPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '$';
    }
}
