package me.golemcore.promptforge.adapter.outbound.analytics;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.promptforge.domain.model.GenerationAnalyticsEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Records generation analytics as structured log lines, off the publishing
 * thread.
 */
@Component
@Slf4j
public class GenerationAnalyticsListener {

    @Async
    @EventListener
    public void onGeneration(GenerationAnalyticsEvent event) {
        log.info("[Analytics] tool={} stage={} success={} confidence={} length={} sources={} enhanced={} latencyMs={}",
                event.getToolId(),
                event.getStage() != null ? event.getStage().getValue() : "unknown",
                event.isSuccess(),
                String.format(Locale.ROOT, "%.2f", event.getConfidenceScore()),
                event.getPromptLength(),
                event.getKnowledgeSourceCount(),
                event.isEnhancementApplied(),
                event.getLatencyMs());
    }
}
