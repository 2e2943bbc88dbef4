package com.openforge.taskcore.pii;

import java.util.List;
import java.util.Map;

/**
 * Output of {@link PiiTokenizer#tokenize(String, int)}.
 *
 * @param tokenizedText the only form of the text allowed to reach an external model
 * @param piiMap        placeholder → original value, in allocation order
 * @param nextIndex     first unused counter value; pass it back in to keep numbering unique
 *                      across several texts belonging to the same request
 */
public record TokenizationResult(
        String tokenizedText,
        Map<String, PiiToken> piiMap,
        int nextIndex
) {

    public boolean hasPII() {
        return !piiMap.isEmpty();
    }

    /** Types in allocation order, safe to log. */
    public List<PiiType> types() {
        return piiMap.values().stream().map(PiiToken::type).toList();
    }
}
