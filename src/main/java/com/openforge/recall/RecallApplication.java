package com.openforge.recall;

import com.openforge.recall.store.MilvusProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

// MilvusProperties is registered here so it exists whether or not the
// conditional Milvus client is loaded. Scheduling drives the arbitration
// learning job, which stays idle unless recall.arbitration.learning.enabled=true.
@SpringBootApplication
@EnableScheduling
@EnableConfigurationProperties(MilvusProperties.class)
public class RecallApplication {

    public static void main(String[] args) {
        SpringApplication.run(RecallApplication.class, args);
    }
}
