package com.openforge.taskcore.agent;

import com.openforge.taskcore.domain.TaskTemplate;
import com.openforge.taskcore.extraction.ExtractionStatus;
import com.openforge.taskcore.template.SimilarityResult;

import java.util.Map;

/**
 * Outcome of planning: either run {@code template} with {@code parameters},
 * or (template null) generate a new template for them.
 */
public record TaskPlan(
        TaskTemplate template,
        SimilarityResult similarity,
        Map<String, Object> parameters,
        ExtractionStatus extractionStatus
) {

    public boolean reusesTemplate() {
        return template != null;
    }
}
