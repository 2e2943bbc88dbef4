package com.openforge.taskcore.template;

import com.openforge.taskcore.domain.TaskTemplate;
import com.openforge.taskcore.domain.TemplateTriggers;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Scores templates against a request using their declared triggers.
 * Used when semantic search is switched off or unavailable.
 *
 * Score (capped at 1.0):
 *   patterns   0.6 for the first matching regex, +0.1 per further match, at most 0.8
 *   keywords   max(0.15, matched / total * 0.25) when at least one keyword matches
 *   direct ask +0.1 when the request starts like "generate … report"
 */
@Slf4j
@Component
public class TriggerPatternMatcher {

    static final double MIN_SCORE = 0.3;

    private static final List<Pattern> DIRECT_ASK = List.of(
            Pattern.compile("^generate.*report", Pattern.CASE_INSENSITIVE),
            Pattern.compile("^create.*report", Pattern.CASE_INSENSITIVE),
            Pattern.compile("^show.*me.*report", Pattern.CASE_INSENSITIVE),
            Pattern.compile("^run.*report", Pattern.CASE_INSENSITIVE),
            Pattern.compile("^make.*report", Pattern.CASE_INSENSITIVE)
    );

    public record TriggerMatch(TaskTemplate template, double score) {}

    /**
     * Best-scoring template above {@link #MIN_SCORE}; ties go to the earlier template in {@code templates}.
     */
    public Optional<TriggerMatch> bestMatch(String message, List<TaskTemplate> templates) {
        TriggerMatch best = null;
        for (TaskTemplate t : templates) {
            double score = score(t, message);
            if (best == null || score > best.score()) {
                best = new TriggerMatch(t, score);
            }
        }
        if (best == null || best.score() <= MIN_SCORE) {
            log.info("[Resolver] No template passed trigger scoring (best={})",
                    best == null ? "none" : String.format("%.2f", best.score()));
            return Optional.empty();
        }
        log.info("[Resolver] Template {} matched by triggers, score={}",
                best.template().getTemplateId(), String.format("%.2f", best.score()));
        return Optional.of(best);
    }

    double score(TaskTemplate template, String message) {
        TemplateTriggers triggers = template.getTriggers();
        if (triggers == null || message == null) return 0.0;

        double score = patternScore(template.getTemplateId(), triggers.patterns(), message)
                + keywordScore(triggers.keywords(), message);

        String trimmed = message.trim();
        if (DIRECT_ASK.stream().anyMatch(p -> p.matcher(trimmed).find())) {
            score += 0.1;
        }
        return Math.min(score, 1.0);
    }

    private double patternScore(String templateId, List<String> patterns, String message) {
        if (patterns == null) return 0.0;
        int matched = 0;
        for (String raw : patterns) {
            if (raw == null) continue;
            try {
                if (Pattern.compile(raw, Pattern.CASE_INSENSITIVE).matcher(message).find()) {
                    matched++;
                }
            } catch (PatternSyntaxException e) {
                log.warn("[Resolver] Invalid trigger pattern in template {}: {}", templateId, raw);
            }
        }
        return matched == 0 ? 0.0 : Math.min(0.6 + (matched - 1) * 0.1, 0.8);
    }

    private static double keywordScore(List<String> keywords, String message) {
        if (keywords == null || keywords.isEmpty()) return 0.0;
        String[] words = message.toLowerCase(Locale.ROOT).split("\\s+");
        long matched = keywords.stream()
                .filter(kw -> kw != null && !kw.isBlank())
                .map(kw -> kw.toLowerCase(Locale.ROOT))
                .filter(kw -> containsKeyword(words, kw))
                .count();
        if (matched == 0) return 0.0;
        return Math.max(0.15, (double) matched / keywords.size() * 0.25);
    }

    private static boolean containsKeyword(String[] words, String keyword) {
        for (String word : words) {
            if (word.isEmpty()) continue;
            if (word.contains(keyword) || (word.length() >= 3 && keyword.contains(word))) {
                return true;
            }
        }
        return false;
    }
}
