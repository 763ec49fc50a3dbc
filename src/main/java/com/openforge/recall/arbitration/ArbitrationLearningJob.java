package com.openforge.recall.arbitration;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Runs the arbitration learning cycle on a fixed delay, never per query.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "recall.arbitration.learning", name = "enabled", havingValue = "true")
public class ArbitrationLearningJob {

    private final ArbitrationLearner learner;

    @Scheduled(initialDelayString = "${recall.arbitration.learning.initial-delay-ms:60000}",
               fixedDelayString   = "${recall.arbitration.learning.interval-ms:300000}")
    public void tick() {
        ArbitrationLearner.CycleResult result = learner.runCycle();
        log.debug("[Arbitration] Learning cycle finished: {}", result.outcome());
    }
}
