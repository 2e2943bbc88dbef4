package com.openforge.taskcore.index;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Connection parameters for the Milvus vector database that holds the template index.
 *
 * application.yml:
 *
 * agent:
 *   milvus:
 *     enabled: true
 *     host: localhost
 *     port: 19530
 *     collection-name: task_templates_index
 *     vector-dimensions: 1536
 */
@ConfigurationProperties(prefix = "agent.milvus")
public record MilvusProperties(
        @DefaultValue("localhost") String host,
        @DefaultValue("19530")     int    port,
        @DefaultValue("task_templates_index") String collectionName,
        @DefaultValue("1536")      int    vectorDimensions
) {}
