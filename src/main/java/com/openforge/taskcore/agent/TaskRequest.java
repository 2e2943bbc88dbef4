package com.openforge.taskcore.agent;

import com.openforge.taskcore.template.EntityScope;
import com.openforge.taskcore.template.UserIntent;

import java.util.Map;

/**
 * A "create task" request as handed over by the agent.
 * Missing intent means reuse is allowed; missing scope means it is read from the text.
 */
public record TaskRequest(
        String description,
        Map<String, Object> explicitParameters,
        UserIntent userIntent,
        EntityScope entityScope
) {

    public TaskRequest {
        if (description == null || description.isBlank()) {
            throw new IllegalArgumentException("Task description must not be blank");
        }
        explicitParameters = explicitParameters == null ? Map.of() : explicitParameters;
        userIntent  = userIntent  == null ? UserIntent.REUSE_EXISTING_TEMPLATE : userIntent;
        entityScope = entityScope == null ? EntityScope.AUTO : entityScope;
    }

    public static TaskRequest of(String description) {
        return new TaskRequest(description, null, null, null);
    }
}
