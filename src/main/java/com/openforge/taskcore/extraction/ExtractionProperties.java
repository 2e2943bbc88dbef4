package com.openforge.taskcore.extraction;

import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * application.yml:
 *
 * agent:
 *   extraction:
 *     temperature: 0.1
 *     max-output-tokens: 4096
 *     default-range-days: 90     # dateRange used when the request names no period
 */
@Validated
@ConfigurationProperties(prefix = "agent.extraction")
public record ExtractionProperties(
        @DefaultValue("0.1")  double temperature,
        @DefaultValue("4096") @Min(1) int maxOutputTokens,
        @DefaultValue("90")   @Min(1) int defaultRangeDays
) {

    public static ExtractionProperties defaults() {
        return new ExtractionProperties(0.1, 4096, 90);
    }
}
