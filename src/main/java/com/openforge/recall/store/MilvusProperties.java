package com.openforge.recall.store;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Connection parameters for the Milvus vector database.
 *
 * application.yml:
 *
 * recall:
 *   milvus:
 *     enabled: true
 *     host: localhost
 *     port: 19530
 *     collection-name: recall_memories
 *     vector-dimensions: 1536
 */
@ConfigurationProperties(prefix = "recall.milvus")
public record MilvusProperties(
        @DefaultValue("true")            boolean enabled,
        @DefaultValue("localhost")       String  host,
        @DefaultValue("19530")           int     port,
        @DefaultValue("recall_memories") String  collectionName,
        @DefaultValue("1536")            int     vectorDimensions
) {}
