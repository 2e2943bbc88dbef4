package com.openforge.taskcore.extraction;

import com.openforge.taskcore.domain.ParameterSchema;
import com.openforge.taskcore.llm.LlmRouter;
import com.openforge.taskcore.pii.PiiRestorer;
import com.openforge.taskcore.pii.PiiTokenizer;
import com.openforge.taskcore.pii.TokenizationResult;
import com.openforge.taskcore.sanitize.PromptSanitizer;
import com.openforge.taskcore.sanitize.SanitizeContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Turns a free-form request into template parameters with the help of the LLM,
 * without the LLM ever seeing raw PII.
 *
 * Pipeline:
 *   tokenize PII → sanitize → prompt (schema-guided or generic) → LLM →
 *   first JSON object (strict, then one repair) → drop "detected"/nulls →
 *   restore PII → overlay on base parameters → default dateRange → alias normalization
 *
 * Never throws for model trouble: an unreachable model or unusable answer yields
 * {@link ExtractionStatus#DEFAULTED} with the base parameters and a default dateRange.
 */
@Slf4j
@Service
@EnableConfigurationProperties(ExtractionProperties.class)
public class ParameterExtractor {

    static final String DETECTED   = "detected";
    static final String DATE_RANGE = "dateRange";

    private final PiiTokenizer            tokenizer;
    private final PiiRestorer             restorer;
    private final PromptSanitizer         sanitizer;
    private final ExtractionPromptBuilder promptBuilder;
    private final LlmRouter               llmRouter;
    private final JsonObjectExtractor     jsonExtractor;
    private final ParameterNameNormalizer normalizer;
    private final ExtractionProperties    properties;
    private final Clock                   clock;

    public ParameterExtractor(PiiTokenizer tokenizer,
                              PiiRestorer restorer,
                              PromptSanitizer sanitizer,
                              ExtractionPromptBuilder promptBuilder,
                              LlmRouter llmRouter,
                              JsonObjectExtractor jsonExtractor,
                              ParameterNameNormalizer normalizer,
                              ExtractionProperties properties,
                              Clock clock) {
        this.tokenizer     = tokenizer;
        this.restorer      = restorer;
        this.sanitizer     = sanitizer;
        this.promptBuilder = promptBuilder;
        this.llmRouter     = llmRouter;
        this.jsonExtractor = jsonExtractor;
        this.normalizer    = normalizer;
        this.properties    = properties;
        this.clock         = clock;
    }

    public ExtractionResult extract(String description, Map<String, Object> baseParameters, ParameterSchema schema) {
        Map<String, Object> base = baseParameters == null ? Map.of() : baseParameters;
        LocalDate today = LocalDate.now(clock);

        // ── 1. Local PII tokenization ─────────────────────────────────────────
        TokenizationResult tokens = tokenizer.tokenize(description == null ? "" : description);
        if (tokens.hasPII()) {
            log.info("[PII] Tokenized {} values before extraction: {}", tokens.piiMap().size(), tokens.types());
        }

        // ── 2. Sanitize ───────────────────────────────────────────────────────
        String tokenized = tokens.tokenizedText() == null ? "" : tokens.tokenizedText();
        String sanitized = sanitizer.sanitize(tokenized, SanitizeContext.TASK_DESCRIPTION);
        if (!sanitized.equals(tokenized)) {
            log.warn("[Extractor] Request text altered by sanitizer ({} -> {} chars)",
                    tokenized.length(), sanitized.length());
        }

        // ── 3. Prompt + model call ────────────────────────────────────────────
        boolean guided = schema != null && schema.hasProperties();
        String prompt = guided
                ? promptBuilder.schemaGuided(sanitized, schema, today)
                : promptBuilder.generic(sanitized, today);

        String response;
        try {
            response = llmRouter.complete(ExtractionPromptBuilder.SYSTEM_PROMPT, prompt,
                    properties.temperature(), properties.maxOutputTokens());
        } catch (RuntimeException e) {
            log.warn("[Extractor] Extraction model unavailable, using defaults: {}", e.getMessage());
            return finish(new LinkedHashMap<>(base), schema, today, ExtractionStatus.DEFAULTED);
        }

        // ── 4. Parse ──────────────────────────────────────────────────────────
        JsonParseOutcome outcome = jsonExtractor.parse(response);
        if (!outcome.isParsed()) {
            log.warn("[Extractor] No usable JSON in model response ({}), using defaults", outcome.fault());
            return finish(new LinkedHashMap<>(base), schema, today, ExtractionStatus.DEFAULTED);
        }

        Map<String, Object> extracted = new LinkedHashMap<>();
        outcome.value().forEach((key, value) -> {
            if (!DETECTED.equals(key) && value != null) extracted.put(key, value);
        });

        // ── 5. Restore PII and merge ──────────────────────────────────────────
        Map<String, Object> restored = restorer.restoreMap(extracted, tokens.piiMap());

        Map<String, Object> merged = new LinkedHashMap<>(base);
        merged.putAll(restored);

        log.info("[Extractor] Extracted parameters {} ({} mode, piiProtected={})",
                restored.keySet(), guided ? "schema" : "generic", tokens.hasPII());
        return finish(merged, schema, today,
                outcome.repaired() ? ExtractionStatus.REPAIRED : ExtractionStatus.CLEAN);
    }

    private ExtractionResult finish(Map<String, Object> parameters,
                                    ParameterSchema schema,
                                    LocalDate today,
                                    ExtractionStatus status) {
        if (parameters.get(DATE_RANGE) == null) {
            parameters.put(DATE_RANGE, defaultDateRange(today));
        }
        return new ExtractionResult(normalizer.normalize(parameters, schema), status);
    }

    Map<String, String> defaultDateRange(LocalDate today) {
        Map<String, String> range = new LinkedHashMap<>();
        range.put("start", today.minusDays(properties.defaultRangeDays()).toString());
        range.put("end", today.toString());
        return range;
    }
}
