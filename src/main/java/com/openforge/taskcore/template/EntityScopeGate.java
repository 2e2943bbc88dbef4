package com.openforge.taskcore.template;

import com.openforge.taskcore.domain.ParameterSchema;
import com.openforge.taskcore.domain.TaskTemplate;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Set;
import java.util.regex.Pattern;

/**
 * Rejects a semantically close template when it is built around one entity
 * (requires e.g. {@code customerId}) but the request asks about many.
 */
@Slf4j
@Component
public class EntityScopeGate {

    public static final Set<String> ENTITY_ID_PARAMS = Set.of("customerId", "contactId", "companyId", "dealId", "leadId");

    private static final Pattern EVERY_ENTITY = Pattern.compile(
            "\\b(?:all|every|each)\\s+(?:\\w+\\s+){0,5}(?:customer|contact|company|invoice|client|deal|lead)",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern PLURAL_ENTITY = Pattern.compile(
            "customers|contacts|companies|invoices|clients|deals|leads", Pattern.CASE_INSENSITIVE);
    private static final Pattern AGGREGATE_WORDS = Pattern.compile(
            "aggregate|total|summary|list\\s+of", Pattern.CASE_INSENSITIVE);

    private static final Pattern NUMBERED_ENTITY = Pattern.compile(
            "(?:customer|contact|company|deal|lead)\\s*#?\\d+", Pattern.CASE_INSENSITIVE);
    private static final Pattern SPECIFIC_OR_THIS_ENTITY = Pattern.compile(
            "(?:specific|this)\\s+(?:customer|contact|company|deal|lead)", Pattern.CASE_INSENSITIVE);

    /** Used only when the stored schema has no required list. */
    private static final Pattern SINGLE_ENTITY_NAME = Pattern.compile(
            "single\\s+customer|specific\\s+customer|one\\s+customer|\\(single", Pattern.CASE_INSENSITIVE);

    public boolean rejects(TaskTemplate template, String description, EntityScope scope) {
        if (!requiresEntityId(template)) return false;

        String text = description == null ? "" : description;
        boolean aggregate = scope == EntityScope.AGGREGATE || isAggregateRequest(text);
        boolean specific  = scope == EntityScope.SPECIFIC_ENTITY || isSpecificEntityReference(text);

        if (aggregate && !specific) {
            log.info("[Resolver] Template {} needs a single entity id but the request is aggregate (scope={}), rejecting",
                    template.getTemplateId(), scope);
            return true;
        }
        return false;
    }

    boolean requiresEntityId(TaskTemplate template) {
        ParameterSchema schema = template.getParameterSchema();
        if (schema != null && schema.required() != null) {
            return schema.required().stream().anyMatch(ENTITY_ID_PARAMS::contains);
        }

        String name = template.getName() == null ? "" : template.getName();
        boolean requires = SINGLE_ENTITY_NAME.matcher(name).find();
        log.warn("[Resolver] Template {} has no required-parameter list, guessed requiresEntityId={} from its name",
                template.getTemplateId(), requires);
        return requires;
    }

    static boolean isAggregateRequest(String text) {
        return EVERY_ENTITY.matcher(text).find()
                || PLURAL_ENTITY.matcher(text).find()
                || AGGREGATE_WORDS.matcher(text).find();
    }

    static boolean isSpecificEntityReference(String text) {
        return NUMBERED_ENTITY.matcher(text).find()
                || SPECIFIC_OR_THIS_ENTITY.matcher(text).find();
    }
}
