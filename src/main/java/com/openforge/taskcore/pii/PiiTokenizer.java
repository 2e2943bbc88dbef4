package com.openforge.taskcore.pii;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;

/**
 * Local, deterministic PII masking. No network calls.
 *
 * Every detected value is replaced by a typed placeholder ({@code [EMAIL_0]},
 * {@code [PHONE_1]}, …). Numbering comes from a counter that lives only for the
 * duration of one call; callers that need to tokenize several texts for the same
 * request thread {@link TokenizationResult#nextIndex()} through explicitly.
 * A value seen twice in one call reuses its placeholder.
 */
@Slf4j
@Component
public class PiiTokenizer {

    public TokenizationResult tokenize(String text) {
        return tokenize(text, 0);
    }

    public TokenizationResult tokenize(String text, int startIndex) {
        if (text == null || text.isBlank()) {
            return new TokenizationResult(text, Map.of(), startIndex);
        }

        TokenAllocator allocator = new TokenAllocator(startIndex);
        String current = text;
        for (PiiType type : PiiType.values()) {
            current = replaceMatches(current, type, allocator);
        }

        TokenizationResult result = new TokenizationResult(
                current, Collections.unmodifiableMap(allocator.piiMap), allocator.next);
        if (result.hasPII()) {
            log.debug("[PII] Tokenized {} values locally: {}", result.piiMap().size(), result.types());
        }
        return result;
    }

    private static String replaceMatches(String text, PiiType type, TokenAllocator allocator) {
        Matcher m = type.pattern().matcher(text);
        StringBuilder out = null;
        int last = 0;
        while (m.find()) {
            int start = m.start(type.valueGroup());
            int end   = m.end(type.valueGroup());
            if (start < last) continue;
            if (out == null) out = new StringBuilder(text.length());
            out.append(text, last, start)
               .append(allocator.tokenFor(type, text.substring(start, end)));
            last = end;
        }
        if (out == null) return text;
        return out.append(text, last, text.length()).toString();
    }

    /** Per-call counter and maps; never shared between calls. */
    private static final class TokenAllocator {

        private final Map<String, PiiToken> piiMap       = new LinkedHashMap<>();
        private final Map<String, String>   tokenByValue = new HashMap<>();
        private int next;

        private TokenAllocator(int start) {
            this.next = start;
        }

        private String tokenFor(PiiType type, String value) {
            return tokenByValue.computeIfAbsent(type.name() + '\u0000' + value, k -> {
                String token = type.token(next++);
                piiMap.put(token, new PiiToken(type, value));
                return token;
            });
        }
    }
}
