package com.openforge.taskcore.repair;

import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.util.List;

/**
 * Auto-repair limits.
 *
 * application.yml:
 *
 * agent:
 *   repair:
 *     max-attempts: 50
 *     self-frame-markers:      # stack substrings that identify the repair subsystem itself
 *       - repairTemplateWithAI
 *       - AutoRepairClassifier.
 *       - RepairBudgetService.
 *       - TemplateRepairer.
 *       - com.openforge.taskcore.repair.
 *
 * Omitting self-frame-markers falls back to {@link #DEFAULT_SELF_FRAME_MARKERS}.
 */
@Validated
@ConfigurationProperties(prefix = "agent.repair")
public record RepairProperties(
        @DefaultValue("50") @Min(0) int maxAttempts,
        List<String> selfFrameMarkers
) {

    public static final List<String> DEFAULT_SELF_FRAME_MARKERS = List.of(
            "repairTemplateWithAI",
            "AutoRepairClassifier.",
            "RepairBudgetService.",
            "TemplateRepairer.",
            "com.openforge.taskcore.repair.");

    public RepairProperties {
        if (selfFrameMarkers == null) {
            selfFrameMarkers = DEFAULT_SELF_FRAME_MARKERS;
        }
    }

    public static RepairProperties defaults() {
        return new RepairProperties(50, DEFAULT_SELF_FRAME_MARKERS);
    }
}
