package com.openforge.taskcore.pii;

import java.util.regex.Pattern;

/**
 * Kinds of PII detected locally before any text leaves the process.
 *
 * Declaration order is detection order: earlier types claim their spans first,
 * so a later pattern never matches inside an already tokenized value.
 */
public enum PiiType {

    EMAIL(Pattern.compile("\\b[A-Za-z0-9._%+-]+@[A-Za-z0-9.-]+\\.[A-Za-z]{2,}\\b"), 0),

    /** NANP numbers: optional +1, optional parentheses, -/./space separators, optional extension. */
    PHONE(Pattern.compile(
            "(?<![\\w+])(?:\\+?1[-.\\s]?)?(?:\\(\\d{3}\\)|\\d{3})[-.\\s]?\\d{3}[-.\\s]?\\d{4}"
                    + "(?:\\s*(?:x|ext\\.?|extension)\\s*\\d{1,6})?\\b"), 0),

    /** Two or more capitalized words after a label such as "name:" or "contact". Only group 1 is PII. */
    NAME(Pattern.compile(
            "\\b(?i:customer name|contact name|client name|name|contact|person|client)(?:\\s*:\\s*|\\s+)"
                    + "([A-Z][a-z]+(?:[ \\t]+[A-Z][a-z]+)+)"), 1),

    ADDRESS(Pattern.compile(
            "\\b\\d+\\s+[A-Z][a-z]+(?:\\s+[A-Z][a-z]+)*\\s+"
                    + "(?:Street|St|Avenue|Ave|Road|Rd|Boulevard|Blvd|Lane|Ln|Drive|Dr|Court|Ct|Way)\\b"), 0);

    private final Pattern pattern;
    private final int     valueGroup;

    PiiType(Pattern pattern, int valueGroup) {
        this.pattern    = pattern;
        this.valueGroup = valueGroup;
    }

    public Pattern pattern() {
        return pattern;
    }

    /** Regex group holding the PII value; 0 = whole match. */
    public int valueGroup() {
        return valueGroup;
    }

    public String token(int index) {
        return "[" + name() + "_" + index + "]";
    }
}
