package me.golemcore.promptforge.domain.service;

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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.promptforge.domain.model.EnhancementRequest;
import me.golemcore.promptforge.domain.model.EnhancementResult;
import me.golemcore.promptforge.domain.model.EnhancementSkipReason;
import me.golemcore.promptforge.domain.model.ToolProfile;
import me.golemcore.promptforge.infrastructure.config.PromptForgeProperties;
import me.golemcore.promptforge.port.outbound.EnhancementPort;
import org.springframework.stereotype.Service;

import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Best-effort rewrite of a composed draft by an external LLM.
 *
 * <p>
 * At most one call is made per draft, bounded by
 * {@link PromptForgeProperties#effectiveEnhancementTimeoutMs()}. The returned future never
 * completes exceptionally on its own: when the feature is disabled, the service
 * is unavailable, the call fails or times out, or the answer is blank or no
 * longer names the project, the original draft comes back unchanged.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PromptEnhancementService {

    private final EnhancementPort enhancementPort;
    private final PromptForgeProperties properties;

    public CompletableFuture<EnhancementResult> enhance(String draft, ToolProfile profile, String projectName) {
        PromptForgeProperties.EnhancementProperties config = properties.getEnhancement();
        if (!config.isEnabled()) {
            log.debug("[Enhancement] Disabled, keeping composed draft");
            return CompletableFuture.completedFuture(EnhancementResult.skipped(draft, EnhancementSkipReason.DISABLED));
        }
        if (!enhancementPort.isAvailable()) {
            log.info("[Enhancement] Service unavailable, keeping composed draft");
            return CompletableFuture
                    .completedFuture(EnhancementResult.skipped(draft, EnhancementSkipReason.UNAVAILABLE));
        }

        EnhancementRequest request = EnhancementRequest.builder()
                .draft(draft)
                .toolId(profile.getId())
                .toolDisplayName(profile.getDisplayName())
                .tone(profile.getTone())
                .projectName(projectName)
                .guidelines(profile.getGuidelines())
                .maxTokens(config.getMaxTokens())
                .temperature(config.getTemperature())
                .build();

        CompletableFuture<String> call;
        try {
            call = enhancementPort.enhance(request);
        } catch (RuntimeException e) {
            log.warn("[Enhancement] Call failed to start for {}: {}", profile.getId(), e.getMessage());
            return CompletableFuture.completedFuture(EnhancementResult.skipped(draft, EnhancementSkipReason.FAILED));
        }

        CompletableFuture<EnhancementResult> result = call
                .orTimeout(properties.effectiveEnhancementTimeoutMs(), TimeUnit.MILLISECONDS)
                .handle((text, error) -> {
                    if (error != null) {
                        return fallback(draft, profile, error);
                    }
                    return accept(draft, text, profile, projectName);
                });
        // Cancelling the outcome aborts the remote call.
        result.whenComplete((ignored, error) -> {
            if (result.isCancelled()) {
                call.cancel(true);
            }
        });
        return result;
    }

    private EnhancementResult accept(String draft, String text, ToolProfile profile, String projectName) {
        if (text == null || text.isBlank()) {
            log.warn("[Enhancement] Blank response for {}, keeping composed draft", profile.getId());
            return EnhancementResult.skipped(draft, EnhancementSkipReason.MALFORMED);
        }
        String enhanced = text.strip();
        if (projectName != null && !enhanced.toLowerCase(Locale.ROOT)
                .contains(projectName.toLowerCase(Locale.ROOT))) {
            log.warn("[Enhancement] Response for {} dropped the project name, keeping composed draft",
                    profile.getId());
            return EnhancementResult.skipped(draft, EnhancementSkipReason.MALFORMED);
        }
        log.debug("[Enhancement] Applied for {} ({} -> {} chars)", profile.getId(), draft.length(),
                enhanced.length());
        return EnhancementResult.applied(enhanced);
    }

    private EnhancementResult fallback(String draft, ToolProfile profile, Throwable error) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null
                ? error.getCause()
                : error;
        if (cause instanceof TimeoutException) {
            log.warn("[Enhancement] Timed out for {}, keeping composed draft", profile.getId());
            return EnhancementResult.skipped(draft, EnhancementSkipReason.TIMEOUT);
        }
        log.warn("[Enhancement] Failed for {}, keeping composed draft: {}", profile.getId(), cause.getMessage());
        return EnhancementResult.skipped(draft, EnhancementSkipReason.FAILED);
    }
}
