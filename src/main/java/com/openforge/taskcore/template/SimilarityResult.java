package com.openforge.taskcore.template;

/**
 * How a template was matched.
 *
 * @param similarityScore cosine similarity in [0, 1]; null for {@link MatchMethod#TRIGGER_PATTERN}
 */
public record SimilarityResult(String templateId, Double similarityScore, MatchMethod matchMethod) {}
