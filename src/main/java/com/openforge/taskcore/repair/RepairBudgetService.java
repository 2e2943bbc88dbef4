package com.openforge.taskcore.repair;

import com.openforge.taskcore.domain.TaskTemplate;
import com.openforge.taskcore.repository.TaskTemplateRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Gatekeeper in front of the (external) repair dispatcher.
 *
 * A positive classification is only honoured after one attempt has been consumed
 * through the conditional increment in {@link TaskTemplateRepository#incrementRepairAttempts},
 * so concurrent failures of the same template cannot overshoot the cap.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RepairBudgetService {

    private final TaskTemplateRepository templateRepository;
    private final AutoRepairClassifier   classifier;
    private final RepairProperties       properties;

    public boolean tryConsumeAttempt(String templateId) {
        if (templateId == null || templateId.isBlank()) return false;
        int updated = templateRepository.incrementRepairAttempts(templateId, properties.maxAttempts());
        if (updated == 0) {
            log.info("[Repair] No attempt left for template {} (cap {})", templateId, properties.maxAttempts());
            return false;
        }
        log.debug("[Repair] Consumed one repair attempt for template {}", templateId);
        return true;
    }

    public RepairDecision evaluateFailure(ExecutionError error, String templateId) {
        TaskTemplate template = templateId == null ? null
                : templateRepository.findByTemplateId(templateId).orElse(null);

        RepairDecision decision = classifier.shouldRepair(error, template);
        if (!decision.shouldRepair()) {
            log.info("[Repair] Template {}: no repair ({})", templateId, decision.reason());
            return decision;
        }
        if (template == null) {
            log.warn("[Repair] Template {} not found, cannot reserve a repair attempt", templateId);
            return RepairDecision.skip("Template not found");
        }
        if (!tryConsumeAttempt(templateId)) {
            return RepairDecision.skip("Attempt budget exhausted");
        }
        log.info("[Repair] Template {}: repair approved ({})", templateId, decision.reason());
        return decision;
    }
}
