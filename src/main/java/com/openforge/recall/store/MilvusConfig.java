package com.openforge.recall.store;

import io.milvus.v2.client.ConnectConfig;
import io.milvus.v2.client.MilvusClientV2;
import io.milvus.v2.common.DataType;
import io.milvus.v2.common.IndexParam;
import io.milvus.v2.service.collection.request.AddFieldReq;
import io.milvus.v2.service.collection.request.CreateCollectionReq;
import io.milvus.v2.service.collection.request.HasCollectionReq;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.lang.Nullable;

import java.util.List;
import java.util.Map;

/**
 * Milvus client bean.
 *
 * On startup:
 *   1. Creates a MilvusClientV2 connected to the configured host:port
 *   2. Checks if the memory collection exists
 *   3. Creates it (with schema + HNSW index) if it doesn't
 *
 * Collection schema  (recall_memories):
 * ┌──────────────────┬─────────────────┬─────────────────────────────────────┐
 * │ Field            │ Type            │ Notes                               │
 * ├──────────────────┼─────────────────┼─────────────────────────────────────┤
 * │ id               │ VARCHAR(128) PK │ assigned by the writer              │
 * │ content          │ VARCHAR(4096)   │ memory text                         │
 * │ payload          │ JSON            │ tags, beliefs, trust, timestamps …  │
 * │ embedding        │ FLOAT_VECTOR    │ dim = vectorDimensions (1536)       │
 * └──────────────────┴─────────────────┴─────────────────────────────────────┘
 *
 * A failed connection leaves the client null: searches then fail and the
 * resilient access layer reports them like any other store outage.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(MilvusProperties.class)
@ConditionalOnProperty(name = "recall.milvus.enabled", havingValue = "true", matchIfMissing = true)
public class MilvusConfig {

    @Bean(destroyMethod = "close")
    @Nullable
    public MilvusClientV2 milvusClient(MilvusProperties props) {
        log.info("[Milvus] Connecting to {}:{}...", props.host(), props.port());
        try {
            MilvusClientV2 client = new MilvusClientV2(
                    ConnectConfig.builder()
                            .uri("http://%s:%d".formatted(props.host(), props.port()))
                            .connectTimeoutMs(15_000)
                            .build()
            );
            log.info("[Milvus] Connected successfully.");
            ensureCollectionExists(client, props);
            return client;
        } catch (Exception e) {
            log.warn("[Milvus] Connection failed, recall will report the store as unavailable. " +
                     "Cause: {}. To suppress this warning, set recall.milvus.enabled=false.",
                    e.getMessage());
            return null;
        }
    }

    // ── Collection bootstrap ─────────────────────────────────────────────────

    private void ensureCollectionExists(MilvusClientV2 client, MilvusProperties props) {
        String name = props.collectionName();

        boolean exists = client.hasCollection(
                HasCollectionReq.builder().collectionName(name).build());
        if (exists) {
            log.info("[Milvus] Collection '{}' already exists, skipping creation.", name);
            return;
        }

        log.info("[Milvus] Creating collection '{}' (dim={})...", name, props.vectorDimensions());

        CreateCollectionReq.CollectionSchema schema =
                CreateCollectionReq.CollectionSchema.builder().build();

        schema.addField(AddFieldReq.builder()
                .fieldName(MilvusVectorStoreClient.FIELD_ID)
                .dataType(DataType.VarChar)
                .maxLength(128)
                .isPrimaryKey(true)
                .autoID(false)
                .build());

        schema.addField(AddFieldReq.builder()
                .fieldName(MilvusVectorStoreClient.FIELD_CONTENT)
                .dataType(DataType.VarChar)
                .maxLength(4096)
                .build());

        schema.addField(AddFieldReq.builder()
                .fieldName(MilvusVectorStoreClient.FIELD_PAYLOAD)
                .dataType(DataType.JSON)
                .build());

        schema.addField(AddFieldReq.builder()
                .fieldName(MilvusVectorStoreClient.FIELD_EMBEDDING)
                .dataType(DataType.FloatVector)
                .dimension(props.vectorDimensions())
                .build());

        // IP on L2-normalized embeddings equals cosine similarity
        IndexParam vectorIndex = IndexParam.builder()
                .fieldName(MilvusVectorStoreClient.FIELD_EMBEDDING)
                .indexType(IndexParam.IndexType.HNSW)
                .metricType(IndexParam.MetricType.IP)
                .extraParams(Map.of("M", 16, "efConstruction", 256))
                .build();

        client.createCollection(CreateCollectionReq.builder()
                .collectionName(name)
                .collectionSchema(schema)
                .indexParams(List.of(vectorIndex))
                .build());

        log.info("[Milvus] Collection '{}' created successfully.", name);
    }
}
