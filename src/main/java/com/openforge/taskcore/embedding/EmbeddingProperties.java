package com.openforge.taskcore.embedding;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Configuration for the OpenAI-compatible text embedding endpoint.
 *
 * application.yml:
 *
 * agent:
 *   embedding:
 *     base-url: https://api.openai.com/v1
 *     api-key: ${EMBEDDING_API_KEY:sk-placeholder}
 *     model: text-embedding-3-small
 *     dimensions: 1536
 *     timeout-seconds: 30
 *     query-prefix: ""          # e.g. "query: " for e5 models
 *     document-prefix: ""       # e.g. "passage: " for e5 models
 *     send-task-type: false     # true for providers that accept RETRIEVAL_QUERY / RETRIEVAL_DOCUMENT
 *
 * The vector dimension must match agent.milvus.vector-dimensions.
 */
@ConfigurationProperties(prefix = "agent.embedding")
public record EmbeddingProperties(
        String baseUrl,
        String apiKey,
        @DefaultValue("text-embedding-3-small") String model,
        @DefaultValue("1536") int dimensions,
        @DefaultValue("30") int timeoutSeconds,
        @DefaultValue("") String queryPrefix,
        @DefaultValue("") String documentPrefix,
        @DefaultValue("false") boolean sendTaskType
) {

    public String prefixFor(EmbeddingMode mode) {
        String prefix = mode == EmbeddingMode.QUERY ? queryPrefix : documentPrefix;
        return prefix == null ? "" : prefix;
    }
}
