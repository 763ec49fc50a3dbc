package com.openforge.recall.config;

import com.openforge.recall.arbitration.ArbitrationProperties;
import com.openforge.recall.embedding.EmbeddingProperties;
import com.openforge.recall.scoring.ScoringWeightResolver;
import com.openforge.recall.selection.SelectionConfig;
import com.openforge.recall.store.MilvusProperties;
import com.openforge.recall.store.StoreProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

/**
 * Prints a structured startup summary after the application context is ready.
 *
 * Milvus connectivity is reported by MilvusConfig at bean creation; only the
 * address is echoed here.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StartupInfoRunner implements ApplicationRunner {

    private final MilvusProperties      milvusProperties;
    private final EmbeddingProperties   embeddingProperties;
    private final StoreProperties       storeProperties;
    private final SelectionConfig       selectionConfig;
    private final ArbitrationProperties arbitrationProperties;
    private final ScoringWeightResolver weightResolver;
    private final Environment           env;

    @Override
    public void run(ApplicationArguments args) {
        String milvusEnabled = env.getProperty("recall.milvus.enabled", "true");
        ArbitrationProperties.Learning learning = arbitrationProperties.learning();

        log.info("""

                ╔══════════════════════════════════════════════════════════╗
                ║              Recall Core  ·  Startup Summary             ║
                ╠══════════════════════════════════════════════════════════╣
                ║  Runtime                                                 ║
                ║    Java Version   : {}
                ╠══════════════════════════════════════════════════════════╣
                ║  Vector Store (Milvus)                                   ║
                ║    Enabled        : {}
                ║    Address        : {}:{}
                ║    Collection     : {}  dim={}
                ║    Timeout        : {}  retries={}  backoff={}
                ║    Breaker        : opens after {} failures for {}
                ╠══════════════════════════════════════════════════════════╣
                ║  Embedding                                               ║
                ║    Model          : {}  dim={}
                ║    Endpoint       : {}  key={}
                ╠══════════════════════════════════════════════════════════╣
                ║  Selection / Scoring                                     ║
                ║    Threshold      : {}  dynamic={} (floor {})
                ║    Fallbacks      : top1={}  min-results={}
                ║    Keyword / MMR  : {} / {} (λ={}, k={})
                ║    Weights        : {}
                ╠══════════════════════════════════════════════════════════╣
                ║  Arbitration                                             ║
                ║    Enabled        : {}  mode={}  policy={}
                ║    Learning       : {}  observe-only={}  every {} ms
                ╚══════════════════════════════════════════════════════════╝
                """,
                System.getProperty("java.version"),

                milvusEnabled,
                milvusProperties.host(), milvusProperties.port(),
                milvusProperties.collectionName(), milvusProperties.vectorDimensions(),
                storeProperties.timeout(), storeProperties.maxRetries(), storeProperties.backoffBase(),
                storeProperties.failureLimit(), storeProperties.openDuration(),

                embeddingProperties.model(), embeddingProperties.dimensions(),
                embeddingProperties.baseUrl(), maskKey(embeddingProperties.apiKey()),

                selectionConfig.threshold(), selectionConfig.dynamicThresholdEnabled(),
                selectionConfig.floorThreshold(),
                selectionConfig.top1FallbackEnabled(), selectionConfig.minResults(),
                selectionConfig.keywordBoostEnabled(), selectionConfig.mmrEnabled(),
                selectionConfig.mmrLambda(), selectionConfig.mmrK(),
                weightResolver.active(),

                arbitrationProperties.enabled(), arbitrationProperties.mode(),
                arbitrationProperties.conflictPolicy(),
                learning.enabled(), learning.observeOnly(), learning.intervalMs()
        );
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    /**
     * Masks an API key: shows first 6 chars + "..." + last 4 chars.
     * Returns "(not set)" if the key looks like a placeholder.
     */
    static String maskKey(String key) {
        if (key == null || key.isBlank() || key.startsWith("sk-placeholder")) {
            return "(not set)";
        }
        if (key.length() <= 10) return "***";
        return key.substring(0, 6) + "..." + key.substring(key.length() - 4);
    }
}
