package com.openforge.recall.store;

import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.reflect.TypeToken;
import com.openforge.recall.candidate.Vectors;
import io.milvus.v2.client.MilvusClientV2;
import io.milvus.v2.service.vector.request.SearchReq;
import io.milvus.v2.service.vector.request.data.FloatVec;
import io.milvus.v2.service.vector.response.SearchResp;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;

import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link VectorStoreClient} over Milvus ANN search.
 *
 * The JSON {@code payload} field carries the loosely typed memory metadata;
 * it is handed on as a plain map and only interpreted by the candidate
 * normalizer. When Milvus is disabled or unreachable every search throws
 * {@link StoreException}.
 */
@Slf4j
@Component
public class MilvusVectorStoreClient implements VectorStoreClient {

    static final String FIELD_ID        = "id";
    static final String FIELD_CONTENT   = "content";
    static final String FIELD_PAYLOAD   = "payload";
    static final String FIELD_EMBEDDING = "embedding";

    private static final Type PAYLOAD_TYPE = new TypeToken<Map<String, Object>>() {}.getType();

    @Nullable
    private final MilvusClientV2   milvusClient;
    private final MilvusProperties props;
    private final Gson             gson = new Gson();

    public MilvusVectorStoreClient(@Nullable MilvusClientV2 milvusClient, MilvusProperties props) {
        this.milvusClient = milvusClient;
        this.props        = props;
        if (milvusClient == null) {
            log.warn("[Milvus] MilvusClientV2 is not available, vector search will fail until it is.");
        }
    }

    @Override
    public List<StoreHit> search(float[] vector, int topK) {
        if (milvusClient == null) {
            throw new StoreException("Vector store unavailable (Milvus not connected)");
        }
        if (vector.length != props.vectorDimensions()) {
            log.debug("[Milvus] Query dim {} differs from collection dim {}", vector.length, props.vectorDimensions());
        }

        List<Float> data = new ArrayList<>(vector.length);
        for (float v : vector) data.add(v);

        SearchResp resp;
        try {
            resp = milvusClient.search(SearchReq.builder()
                    .collectionName(props.collectionName())
                    .data(List.of(new FloatVec(data)))
                    .annsField(FIELD_EMBEDDING)
                    .topK(topK)
                    .outputFields(List.of(FIELD_CONTENT, FIELD_PAYLOAD, FIELD_EMBEDDING))
                    .build());
        } catch (RuntimeException e) {
            throw new StoreException("Milvus search failed: " + e.getMessage(), e);
        }

        List<StoreHit> hits = new ArrayList<>();
        if (resp == null || resp.getSearchResults() == null) return hits;

        for (List<SearchResp.SearchResult> row : resp.getSearchResults()) {
            for (SearchResp.SearchResult hit : row) {
                hits.add(toHit(hit));
            }
        }
        log.debug("[Milvus] {} hit(s) from '{}'", hits.size(), props.collectionName());
        return hits;
    }

    // ── Conversion ───────────────────────────────────────────────────────────

    private StoreHit toHit(SearchResp.SearchResult hit) {
        Map<String, Object> entity = hit.getEntity() == null ? Map.of() : hit.getEntity();
        Float score = hit.getScore();

        Map<String, Object> payload = new HashMap<>(payloadOf(entity.get(FIELD_PAYLOAD)));
        Object content = entity.get(FIELD_CONTENT);
        if (content != null) payload.putIfAbsent(FIELD_CONTENT, content);

        return new StoreHit(
                String.valueOf(hit.getId()),
                score == null ? 0.0 : score.doubleValue(),
                payload,
                embeddingOf(entity.get(FIELD_EMBEDDING)));
    }

    private Map<String, Object> payloadOf(@Nullable Object raw) {
        if (raw == null) return Map.of();
        if (raw instanceof JsonElement json) {
            if (!json.isJsonObject()) return Map.of();
            Map<String, Object> m = gson.fromJson(json, PAYLOAD_TYPE);
            return m == null ? Map.of() : m;
        }
        if (raw instanceof String s && !s.isBlank()) {
            Map<String, Object> m = gson.fromJson(s, PAYLOAD_TYPE);
            return m == null ? Map.of() : m;
        }
        if (raw instanceof Map<?, ?> map) {
            Map<String, Object> m = new HashMap<>();
            map.forEach((k, v) -> m.put(String.valueOf(k), v));
            return m;
        }
        throw new StoreException("Unexpected payload type " + raw.getClass().getSimpleName());
    }

    @Nullable
    private static float[] embeddingOf(@Nullable Object raw) {
        return raw instanceof List<?> list ? Vectors.toArray(list) : null;
    }
}
