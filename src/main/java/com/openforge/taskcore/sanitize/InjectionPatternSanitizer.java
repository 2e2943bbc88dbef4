package com.openforge.taskcore.sanitize;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Default {@link PromptSanitizer}.
 *
 * <ol>
 *   <li>Strip control characters other than tab, newline and carriage return.</li>
 *   <li>Replace role-switch / instruction-override phrases with {@code [REMOVED]}.</li>
 *   <li>Wrap code markers as {@code [CODE: …]} (already wrapped ones are left alone).</li>
 *   <li>Truncate to the context's length cap.</li>
 * </ol>
 */
@Component
public class InjectionPatternSanitizer implements PromptSanitizer {

    static final String REMOVED = "[REMOVED]";

    private static final Pattern CONTROL_CHARS = Pattern.compile("[\\x00-\\x08\\x0B\\x0C\\x0E-\\x1F\\x7F]");

    private static final List<Pattern> INJECTION_PATTERNS = List.of(
            Pattern.compile("ignore\\s+(?:previous|all|above|prior)\\s+instructions?", Pattern.CASE_INSENSITIVE),
            Pattern.compile("disregard\\s+(?:previous|all|above)\\s+(?:instructions?|rules?)", Pattern.CASE_INSENSITIVE),
            Pattern.compile("system\\s*:\\s*", Pattern.CASE_INSENSITIVE),
            Pattern.compile("assistant\\s*:\\s*", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\[INST]", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\[/INST]", Pattern.CASE_INSENSITIVE),
            Pattern.compile("<\\|im_start\\|>", Pattern.CASE_INSENSITIVE),
            Pattern.compile("<\\|im_end\\|>", Pattern.CASE_INSENSITIVE),
            Pattern.compile("```\\s*system", Pattern.CASE_INSENSITIVE),
            Pattern.compile("new\\s+instructions?:", Pattern.CASE_INSENSITIVE),
            Pattern.compile("updated\\s+instructions?:", Pattern.CASE_INSENSITIVE)
    );

    private static final String NOT_WRAPPED = "(?<!\\[CODE: )";

    private static final List<Pattern> CODE_PATTERNS = List.of(
            Pattern.compile(NOT_WRAPPED + "process\\.env"),
            Pattern.compile(NOT_WRAPPED + "require\\s*\\("),
            Pattern.compile(NOT_WRAPPED + "eval\\s*\\("),
            Pattern.compile(NOT_WRAPPED + "Function\\s*\\("),
            Pattern.compile(NOT_WRAPPED + "__dirname"),
            Pattern.compile(NOT_WRAPPED + "child_process")
    );

    @Override
    public String sanitize(String text, SanitizeContext context) {
        if (text == null || text.isEmpty()) return "";
        SanitizeContext ctx = context != null ? context : SanitizeContext.GENERAL;

        String out = CONTROL_CHARS.matcher(text).replaceAll("");

        for (Pattern p : INJECTION_PATTERNS) {
            out = p.matcher(out).replaceAll(Matcher.quoteReplacement(REMOVED));
        }
        for (Pattern p : CODE_PATTERNS) {
            out = p.matcher(out).replaceAll(m -> Matcher.quoteReplacement("[CODE: " + m.group() + "]"));
        }

        return out.length() > ctx.maxLength() ? out.substring(0, ctx.maxLength()) : out;
    }
}
