package com.openforge.taskcore.llm;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Providers used for parameter extraction, under "agent.llm".
 *
 * agent:
 *   llm:
 *     primary:
 *       name: gemini
 *       base-url: https://generativelanguage.googleapis.com/v1beta/openai
 *       api-key: ...
 *       model: gemini-2.0-flash
 *       timeout-seconds: 60
 *       json-mode: true        # send response_format json_object
 *     fallback:                # optional; leave base-url empty to disable
 *       name: deepseek
 *       base-url: https://api.deepseek.com/v1
 *       model: deepseek-chat
 */
@Validated
@ConfigurationProperties(prefix = "agent.llm")
public record LlmProperties(
        @NotNull @Valid ProviderConfig primary,
        @Valid ProviderConfig fallback
) {

    public boolean hasFallback() {
        return fallback != null && fallback.baseUrl() != null && !fallback.baseUrl().isBlank();
    }

    public record ProviderConfig(
            @NotBlank String name,
            String baseUrl,
            String apiKey,
            @NotBlank String model,
            @DefaultValue("120") int timeoutSeconds,
            // extraction always wants a single JSON object back
            @DefaultValue("true") boolean jsonMode
    ) {}
}
