package com.openforge.taskcore.agent;

import com.openforge.taskcore.domain.ParameterSchema;
import com.openforge.taskcore.domain.TaskTemplate;
import com.openforge.taskcore.extraction.ExtractionResult;
import com.openforge.taskcore.extraction.ParameterExtractor;
import com.openforge.taskcore.template.EntityScopeGate;
import com.openforge.taskcore.template.ResolvedTemplate;
import com.openforge.taskcore.template.TemplateResolver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * "Create task" control flow: resolve a template, then extract parameters guided
 * by its schema. Template generation and execution are the caller's business.
 *
 * A matched template whose schema requires an entity id is dropped when
 * extraction found none, since running it could only fail.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TaskPlanningService {

    private final TemplateResolver   templateResolver;
    private final ParameterExtractor parameterExtractor;

    public TaskPlan plan(TaskRequest request) {
        Optional<ResolvedTemplate> resolved = templateResolver.resolve(
                request.description(), request.userIntent(), request.entityScope());

        ParameterSchema schema = resolved.map(r -> r.template().getParameterSchema()).orElse(null);
        ExtractionResult extraction = parameterExtractor.extract(
                request.description(), request.explicitParameters(), schema);

        if (resolved.isEmpty()) {
            log.info("[Planner] No reusable template, new one must be generated");
            return new TaskPlan(null, null, extraction.parameters(), extraction.status());
        }

        TaskTemplate template = resolved.get().template();
        if (missingRequiredEntityId(schema, extraction.parameters())) {
            log.info("[Planner] Template {} requires an entity id but none was extracted, generating instead",
                    template.getTemplateId());
            return new TaskPlan(null, null, extraction.parameters(), extraction.status());
        }

        log.info("[Planner] Reusing template {} with parameters {}", template.getTemplateId(),
                extraction.parameters().keySet());
        return new TaskPlan(template, resolved.get().similarity(), extraction.parameters(), extraction.status());
    }

    private static boolean missingRequiredEntityId(ParameterSchema schema, Map<String, Object> parameters) {
        if (schema == null || schema.required() == null) return false;
        List<String> requiredIds = schema.required().stream()
                .filter(EntityScopeGate.ENTITY_ID_PARAMS::contains)
                .toList();
        if (requiredIds.isEmpty()) return false;
        return EntityScopeGate.ENTITY_ID_PARAMS.stream().noneMatch(id -> hasValue(parameters.get(id)));
    }

    private static boolean hasValue(Object value) {
        if (value == null) return false;
        return !(value instanceof String s) || !s.isBlank();
    }
}
