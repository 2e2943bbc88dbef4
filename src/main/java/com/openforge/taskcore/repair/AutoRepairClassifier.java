package com.openforge.taskcore.repair;

import com.openforge.taskcore.domain.TaskTemplate;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Decides whether a failed template execution is worth an automated repair.
 *
 * Only code defects in the generated template qualify. Infrastructure trouble
 * (network, timeouts, rate limits, upstream 5xx), auth problems, cancellations,
 * failures inside the repair machinery and templates that have used up their
 * attempt budget never do. Rules are evaluated in order; the first that fires wins.
 *
 * Pure and synchronous; never throws.
 */
@Slf4j
@Component
@EnableConfigurationProperties(RepairProperties.class)
public class AutoRepairClassifier {

    private static final Set<String> NON_REPAIRABLE_NAMES = Set.of(
            "AxiosError",
            "TimeoutError",
            "NetworkError",
            "AuthenticationError",
            "PermissionError",
            "TaskCancelledError"
    );

    private static final Set<String> CODE_DEFECT_NAMES = Set.of(
            "ReferenceError",
            "TypeError",
            "SyntaxError"
    );

    private static final List<Pattern> INFRASTRUCTURE_MESSAGES = List.of(
            Pattern.compile("timeout.*exceeded", Pattern.CASE_INSENSITIVE),
            // "timed out" / "time-out while …"; a bare "timeout" may just be a property name
            Pattern.compile("\\btimed[ -]?out\\b|\\btime-out\\b|\\btimeout (?:of|after|while|waiting)\\b",
                    Pattern.CASE_INSENSITIVE),
            Pattern.compile("ETIMEDOUT|ECONNREFUSED|ECONNRESET", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\b429\\b"),
            Pattern.compile("\\b50[234]\\b"),
            Pattern.compile("bad gateway|service unavailable|gateway timeout", Pattern.CASE_INSENSITIVE),
            Pattern.compile("rate[ -]?limit|too many requests", Pattern.CASE_INSENSITIVE)
    );

    private final RepairProperties properties;

    public AutoRepairClassifier(RepairProperties properties) {
        this.properties = properties;
    }

    public RepairDecision shouldRepair(ExecutionError error, TaskTemplate template) {
        ExecutionError err = error != null ? error : ExecutionError.empty();
        int attempts = template != null ? template.getRepairAttempts() : 0;

        if (attempts >= properties.maxAttempts()) {
            log.info("[Repair] Max repair attempts reached ({}/{}), skipping",
                    attempts, properties.maxAttempts());
            return RepairDecision.skip("Max repair attempts reached (" + attempts + ")");
        }

        String stack = err.stackOrEmpty();
        for (String marker : properties.selfFrameMarkers()) {
            if (!marker.isEmpty() && stack.contains(marker)) {
                log.warn("[Repair] Failure originated inside the repair subsystem ({}), skipping", marker);
                return RepairDecision.skip("Error originated in the repair subsystem");
            }
        }

        String name = err.nameOrEmpty();
        if (NON_REPAIRABLE_NAMES.contains(name)) {
            return RepairDecision.skip(name + " is not a code defect");
        }

        String message = err.messageOrEmpty();
        for (Pattern p : INFRASTRUCTURE_MESSAGES) {
            if (p.matcher(message).find()) {
                return RepairDecision.skip("Infrastructure error: " + abbreviate(message));
            }
        }

        if (CODE_DEFECT_NAMES.contains(name)) {
            return RepairDecision.repair(name + " indicates a code defect");
        }
        return RepairDecision.repair("Unclassified error, assuming code defect");
    }

    private static String abbreviate(String message) {
        return message.length() <= 100 ? message : message.substring(0, 100) + "...";
    }
}
