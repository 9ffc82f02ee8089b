package me.golemcore.promptforge.infrastructure.config;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Core beans shared by the generation pipeline, plus a startup summary of the
 * active configuration.
 *
 * @since 1.0
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class AutoConfiguration {

    private final PromptForgeProperties properties;

    @Bean
    public static Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public static ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    /**
     * Cached pool of daemon threads. Each generation request runs as one
     * short-lived task; idle threads are reclaimed after a minute.
     */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService generationExecutor() {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "prompt-generation-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    @PostConstruct
    public void init() {
        log.info("PromptForge starting...");
        log.info("Tool profiles: {}", properties.getProfiles().getLocation());
        log.info("Embedding provider: {}", properties.getEmbedding().getProvider());
        log.info("Enhancement: {}", properties.getEnhancement().isEnabled()
                ? properties.getEnhancement().getModel()
                : "disabled");
        long configured = properties.getEnhancement().getTimeoutMs();
        long effective = properties.effectiveEnhancementTimeoutMs();
        if (effective != configured) {
            log.warn("Enhancement timeout {}ms is not shorter than the retrieval timeout {}ms, using {}ms",
                    configured, properties.getRetrieval().getTimeoutMs(), effective);
        }
    }
}
