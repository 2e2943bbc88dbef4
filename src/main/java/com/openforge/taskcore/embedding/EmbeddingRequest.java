package com.openforge.taskcore.embedding;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Request body for POST /embeddings.
 *
 * Wire format:
 * {
 *   "input": "query: monthly invoice report",
 *   "model": "text-embedding-3-small",
 *   "dimensions": 1536,
 *   "task_type": "RETRIEVAL_QUERY"     // only when agent.embedding.send-task-type=true
 * }
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record EmbeddingRequest(
        String input,
        String model,
        Integer dimensions,
        String taskType
) {

    static final int MAX_INPUT_CHARS = 8000;

    /**
     * Builds the request for one side of the retrieval pair: the mode's prefix is
     * prepended, the input is cut to {@link #MAX_INPUT_CHARS}, and the task type is
     * sent when the provider understands it.
     */
    public static EmbeddingRequest forMode(String text, EmbeddingMode mode, EmbeddingProperties props) {
        String input = props.prefixFor(mode) + text;
        if (input.length() > MAX_INPUT_CHARS) input = input.substring(0, MAX_INPUT_CHARS);
        return new EmbeddingRequest(input, props.model(), props.dimensions(),
                props.sendTaskType() ? mode.taskType() : null);
    }
}
