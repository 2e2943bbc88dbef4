package com.openforge.taskcore.extraction;

import java.util.Map;

/**
 * Result of reading a JSON object out of free-form model output.
 * Exactly one of {@code value} / {@code fault} is non-null.
 */
public record JsonParseOutcome(Map<String, Object> value, boolean repaired, ParseFault fault) {

    public enum ParseFault {
        NO_JSON_OBJECT,
        MALFORMED_JSON,
        NOT_AN_OBJECT
    }

    public static JsonParseOutcome parsed(Map<String, Object> value, boolean repaired) {
        return new JsonParseOutcome(value, repaired, null);
    }

    public static JsonParseOutcome failed(ParseFault fault) {
        return new JsonParseOutcome(null, false, fault);
    }

    public boolean isParsed() {
        return fault == null;
    }
}
