package com.openforge.taskcore.extraction;

import com.openforge.taskcore.domain.ParameterSchema;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Prompts for the extraction model. The request text passed in is already
 * tokenized and sanitized.
 */
@Component
public class ExtractionPromptBuilder {

    static final String SYSTEM_PROMPT =
            "You extract structured parameters from user requests. Reply with a single JSON object and nothing else.";

    private static final String TOKEN_NOTE =
            "Text may contain tokens like [EMAIL_0], [PHONE_1], [NAME_2], [ADDRESS_3]. Preserve these tokens exactly as-is.";

    public String schemaGuided(String requestText, ParameterSchema schema, LocalDate today) {
        String properties = schema.properties().entrySet().stream()
                .map(e -> describe(e, schema))
                .collect(Collectors.joining("\n"));

        return """
                Extract parameters from the user request according to this EXACT schema.

                User Message: "%s"
                Current Date: %s

                TEMPLATE PARAMETER SCHEMA (use these EXACT parameter names):
                %s

                EXTRACTION RULES:
                1. %s
                2. For array parameters, turn comma-, newline- or space-separated lists into JSON arrays.
                3. For arrays of strings convert every item to a string, e.g. [182080, 182038] -> ["182080", "182038"].
                4. For arrays of numbers parse every item as a number.
                5. Use only the parameter names from the schema above. Do not invent new names.
                6. Return ONLY valid JSON with quoted property names. No explanations, no markdown.

                Examples:
                - "IDs: 123, 456, 789" with messageIds (array of string) -> {"messageIds": ["123", "456", "789"]}
                - "Process items 1 2 3" with items (array of number) -> {"items": [1, 2, 3]}

                JSON object:""".formatted(requestText, today, properties, TOKEN_NOTE);
    }

    public String generic(String requestText, LocalDate today) {
        return """
                Analyze this user request and extract every parameter it mentions.

                User Message: "%s"
                Current Date: %s

                NOTE: %s

                Return ONLY a JSON object of this shape, including only fields that are actually mentioned:
                {
                  "customerId": "customer id if mentioned (e.g. '158', 'CUST-123')",
                  "companyId": "company id if mentioned",
                  "contactId": "contact id if mentioned",
                  "dealId": "deal id if mentioned",
                  "invoiceId": "invoice id if mentioned",
                  "email": "email token if found (e.g. '[EMAIL_0]')",
                  "phone": "phone token if found",
                  "name": "name token if found",
                  "address": "address token if found",
                  "dateRange": { "start": "YYYY-MM-DD", "end": "YYYY-MM-DD" },
                  "detected": "short description of what was detected"
                }

                Rules:
                - Read ids from phrases like "customer id 158", "customer 158", "id 158".
                - Resolve relative periods ("last 30 days", "last 2 months") against the current date.
                - Return only the JSON, no other text or formatting.

                JSON object:""".formatted(requestText, today, TOKEN_NOTE);
    }

    private static String describe(Map.Entry<String, ParameterSchema.PropertySpec> entry, ParameterSchema schema) {
        ParameterSchema.PropertySpec spec = entry.getValue();
        StringBuilder line = new StringBuilder("  \"").append(entry.getKey()).append('"');
        if (schema.isRequired(entry.getKey())) line.append(" (REQUIRED)");
        line.append(": ").append(spec == null ? "any" : spec.describeType());
        if (spec != null && spec.description() != null && !spec.description().isBlank()) {
            line.append(" - ").append(spec.description());
        }
        return line.toString();
    }
}
