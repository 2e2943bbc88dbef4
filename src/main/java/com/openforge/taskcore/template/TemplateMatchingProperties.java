package com.openforge.taskcore.template;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Template matching thresholds.
 *
 * application.yml:
 *
 * agent:
 *   templates:
 *     vector-search-enabled: true     # false = trigger patterns only
 *     similarity-threshold: 0.70      # below this a new template is generated
 *     name-priority-threshold: 0.85   # name-only hit above this wins over the full-text hit
 *     top-k: 5
 */
@Validated
@ConfigurationProperties(prefix = "agent.templates")
public record TemplateMatchingProperties(
        @DefaultValue("true") boolean vectorSearchEnabled,
        @DefaultValue("0.70") @DecimalMin("0.0") @DecimalMax("1.0") double similarityThreshold,
        @DefaultValue("0.85") @DecimalMin("0.0") @DecimalMax("1.0") double namePriorityThreshold,
        @DefaultValue("5")    @Min(1) int topK
) {

    public static TemplateMatchingProperties defaults() {
        return new TemplateMatchingProperties(true, 0.70, 0.85, 5);
    }
}
