package com.openforge.taskcore.domain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;
import java.util.Map;

/**
 * JSON-Schema-like description of a template's input parameters.
 *
 * <pre>
 * {
 *   "properties": {
 *     "customerId": { "type": "string", "description": "CRM customer id" },
 *     "messageIds": { "type": "array", "items": { "type": "string" } }
 *   },
 *   "required": ["customerId"]
 * }
 * </pre>
 *
 * Either field may be null when the stored definition is incomplete or corrupted.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record ParameterSchema(
        Map<String, PropertySpec> properties,
        List<String> required
) {

    public boolean hasProperties() {
        return properties != null && !properties.isEmpty();
    }

    public boolean isRequired(String name) {
        return required != null && required.contains(name);
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record PropertySpec(
            String type,
            PropertySpec items,
            String description
    ) {

        /** "array of string", "number", … as shown to the extraction model. */
        public String describeType() {
            String base = type != null ? type : "any";
            if ("array".equals(base) && items != null && items.type() != null) {
                return "array of " + items.type();
            }
            return base;
        }
    }
}
