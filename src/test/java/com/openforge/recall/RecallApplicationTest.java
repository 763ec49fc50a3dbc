package com.openforge.recall;

import com.openforge.recall.embedding.EmbeddingProvider;
import com.openforge.recall.retrieval.RankedCandidate;
import com.openforge.recall.retrieval.RetrievalResult;
import com.openforge.recall.retrieval.RetrievalService;
import com.openforge.recall.scoring.ScoringWeightResolver;
import com.openforge.recall.store.FetchOutcome;
import com.openforge.recall.store.ResilientStoreAccess;
import com.openforge.recall.store.StoreHit;
import com.openforge.recall.store.StoreProperties;
import com.openforge.recall.store.VectorStoreClient;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.context.ActiveProfiles;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;

@SpringBootTest
@ActiveProfiles("test")
class RecallApplicationTest {

    @MockBean
    VectorStoreClient vectorStore;

    @MockBean
    EmbeddingProvider embeddings;

    @Autowired
    RetrievalService retrieval;

    @Autowired
    ResilientStoreAccess storeAccess;

    @Autowired
    StoreProperties storeProperties;

    @Autowired
    ScoringWeightResolver weights;

    @Test
    void profileSettingsAreBound() {
        assertThat(storeProperties.timeout()).isEqualTo(Duration.ofMillis(200));
        assertThat(storeProperties.maxRetries()).isZero();
        assertThat(weights.resolve("recency-heavy").wRec()).isEqualTo(1.2);
        assertThat(weights.resolve("recency-heavy").decayLambda()).isEqualTo(0.05);
        assertThat(weights.active().wSim()).isEqualTo(weights.resolve("default").wSim());
    }

    @Test
    void retrievesThroughTheWiredPipeline() {
        when(embeddings.embed(anyString())).thenReturn(new float[]{1f, 0f});
        when(vectorStore.search(any(), anyInt())).thenReturn(List.of(
                new StoreHit("m1", 0.92, Map.of("content", "Backups run nightly at 02:00"), new float[]{1f, 0f}),
                new StoreHit("m2", 0.12, Map.of("content", "Lunch is at noon"), new float[]{0f, 1f})));

        RetrievalResult result = retrieval.retrieve("when do backups run");

        assertThat(result.results()).extracting(RankedCandidate::id).containsExactly("m1");
        assertThat(result.diagnostics().fetchOutcome()).isEqualTo(FetchOutcome.OK);
        assertThat(storeAccess.isOpen()).isFalse();
    }
}
