package com.openforge.taskcore.template;

import com.openforge.taskcore.domain.TaskTemplate;
import com.openforge.taskcore.embedding.EmbeddingMode;
import com.openforge.taskcore.embedding.EmbeddingService;
import com.openforge.taskcore.index.NeighborHit;
import com.openforge.taskcore.index.TemplateVectorSearch;
import com.openforge.taskcore.index.VectorField;
import com.openforge.taskcore.repository.TaskTemplateRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Finds an existing template that satisfies a request, or reports that a new one
 * must be generated (empty result).
 *
 * Primary path: embed the request once, search the name-only and the full-text
 * vectors independently, pick one hit, then run it through the gates
 * (distance present, similarity threshold, template still enabled, entity scope).
 * When semantic search is switched off, has no backend, or fails, templates are
 * scored by their trigger patterns instead. A trigger match carries no score and
 * skips the gates; the planner checks entity ids once parameters are extracted.
 */
@Slf4j
@Service
@EnableConfigurationProperties(TemplateMatchingProperties.class)
public class TemplateResolver {

    private final EmbeddingService           embeddingService;
    private final TemplateVectorSearch       vectorSearch;
    private final TaskTemplateRepository     templateRepository;
    private final EntityScopeGate            entityScopeGate;
    private final TriggerPatternMatcher      triggerMatcher;
    private final TemplateMatchingProperties properties;

    public TemplateResolver(EmbeddingService embeddingService,
                            TemplateVectorSearch vectorSearch,
                            TaskTemplateRepository templateRepository,
                            EntityScopeGate entityScopeGate,
                            TriggerPatternMatcher triggerMatcher,
                            TemplateMatchingProperties properties) {
        this.embeddingService   = embeddingService;
        this.vectorSearch       = vectorSearch;
        this.templateRepository = templateRepository;
        this.entityScopeGate    = entityScopeGate;
        this.triggerMatcher     = triggerMatcher;
        this.properties         = properties;
    }

    public Optional<ResolvedTemplate> resolve(String description, UserIntent userIntent, EntityScope entityScope) {
        if (userIntent == UserIntent.CREATE_NEW_TASK) {
            log.info("[Resolver] Caller asked for a new task, skipping template lookup");
            return Optional.empty();
        }
        if (description == null || description.isBlank()) {
            return Optional.empty();
        }
        EntityScope scope = entityScope != null ? entityScope : EntityScope.AUTO;

        if (!properties.vectorSearchEnabled()) {
            log.info("[Resolver] Semantic matching disabled, using trigger patterns");
            return resolveByTriggers(description);
        }
        if (!vectorSearch.isAvailable()) {
            log.warn("[Resolver] No vector backend connected, using trigger patterns");
            return resolveByTriggers(description);
        }

        SearchHits hits;
        try {
            hits = search(description);
        } catch (RuntimeException e) {
            log.warn("[Resolver] Semantic search failed, falling back to trigger patterns: {}", e.getMessage());
            return resolveByTriggers(description);
        }
        return selectAndGate(hits, description, scope);
    }

    // ── Semantic path ────────────────────────────────────────────────────────

    private record SearchHits(NeighborHit bestName, NeighborHit bestFullText) {}

    private SearchHits search(String description) {
        List<Float> query = embeddingService.embed(description, EmbeddingMode.QUERY);
        List<NeighborHit> byName = vectorSearch.nearestNeighbors(VectorField.NAME, query, properties.topK());
        List<NeighborHit> byFull = vectorSearch.nearestNeighbors(VectorField.FULL_TEXT, query, properties.topK());
        return new SearchHits(first(byName), first(byFull));
    }

    private Optional<ResolvedTemplate> selectAndGate(SearchHits hits, String description, EntityScope scope) {
        NeighborHit bestName = hits.bestName();
        NeighborHit bestFull = hits.bestFullText();
        if (bestName == null && bestFull == null) {
            log.warn("[Resolver] Vector search returned no templates");
            return Optional.empty();
        }

        double nameScore = bestName != null && bestName.hasDistance() ? bestName.similarity() : 0.0;

        NeighborHit selected;
        MatchMethod method;
        if (bestName != null && nameScore > properties.namePriorityThreshold()) {
            selected = bestName;
            method   = MatchMethod.NAME_EMBEDDING;
        } else if (bestFull != null) {
            selected = bestFull;
            method   = MatchMethod.FULL_EMBEDDING;
        } else {
            selected = bestName;
            method   = MatchMethod.NAME_EMBEDDING;
        }

        if (!selected.hasDistance()) {
            log.error("[Resolver] Vector search returned no distance for template {} ({}), rejecting all matches",
                    selected.templateId(), method);
            return Optional.empty();
        }

        double similarity = selected.similarity();
        if (similarity < properties.similarityThreshold()) {
            log.info("[Resolver] Best match {} at {} is below threshold {}, a new template is needed",
                    selected.templateId(), percent(similarity), percent(properties.similarityThreshold()));
            return Optional.empty();
        }

        Optional<TaskTemplate> stored = templateRepository.findByTemplateId(selected.templateId())
                .filter(TaskTemplate::isEnabled);
        if (stored.isEmpty()) {
            log.warn("[Resolver] Index points at missing or disabled template {}", selected.templateId());
            return Optional.empty();
        }

        TaskTemplate template = stored.get();
        if (entityScopeGate.rejects(template, description, scope)) {
            return Optional.empty();
        }

        log.info("[Resolver] Matched template {} ({}) via {} at {}",
                template.getTemplateId(), template.getName(), method, percent(similarity));
        return Optional.of(new ResolvedTemplate(template,
                new SimilarityResult(template.getTemplateId(), similarity, method)));
    }

    // ── Trigger fallback ─────────────────────────────────────────────────────

    private Optional<ResolvedTemplate> resolveByTriggers(String description) {
        List<TaskTemplate> templates;
        try {
            templates = templateRepository.findByEnabledTrueOrderByTemplateIdAsc();
        } catch (DataAccessException e) {
            log.error("[Resolver] Could not load templates for trigger matching: {}", e.getMessage());
            return Optional.empty();
        }

        return triggerMatcher.bestMatch(description, templates)
                .map(TriggerPatternMatcher.TriggerMatch::template)
                .map(t -> new ResolvedTemplate(t,
                        new SimilarityResult(t.getTemplateId(), null, MatchMethod.TRIGGER_PATTERN)));
    }

    private static NeighborHit first(List<NeighborHit> hits) {
        return hits == null || hits.isEmpty() ? null : hits.get(0);
    }

    private static String percent(double score) {
        return String.format("%.1f%%", score * 100);
    }
}
