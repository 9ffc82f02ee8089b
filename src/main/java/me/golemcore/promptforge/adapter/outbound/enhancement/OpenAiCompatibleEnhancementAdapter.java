package me.golemcore.promptforge.adapter.outbound.enhancement;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.promptforge.domain.model.EnhancementRequest;
import me.golemcore.promptforge.infrastructure.config.PromptForgeProperties;
import me.golemcore.promptforge.port.outbound.EnhancementPort;
import okhttp3.Call;
import okhttp3.Callback;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Enhancement adapter for OpenAI-compatible chat completion APIs.
 *
 * <p>
 * Sends the composed draft to {@code {api-url}/chat/completions} and returns
 * {@code choices[0].message.content}. Non-2xx answers and unparseable bodies
 * yield an empty string; transport errors complete the future exceptionally.
 * Cancelling the returned future cancels the HTTP call.
 *
 * <p>
 * Configuration:
 * <ul>
 * <li>{@code promptforge.enhancement.api-url} - API base URL
 * <li>{@code promptforge.enhancement.api-key} - bearer token
 * <li>{@code promptforge.enhancement.model} - chat model name
 * <li>{@code promptforge.enhancement.timeout-ms} - HTTP call timeout, kept
 * below {@code promptforge.retrieval.timeout-ms}
 * </ul>
 *
 * @see me.golemcore.promptforge.domain.service.PromptEnhancementService
 */
@Component
@Slf4j
public class OpenAiCompatibleEnhancementAdapter implements EnhancementPort {

    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    private final PromptForgeProperties properties;
    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;

    public OpenAiCompatibleEnhancementAdapter(PromptForgeProperties properties, OkHttpClient baseHttpClient,
            ObjectMapper objectMapper) {
        this.properties = properties;
        this.objectMapper = objectMapper;

        long timeoutMs = properties.effectiveEnhancementTimeoutMs();
        this.httpClient = baseHttpClient.newBuilder()
                .callTimeout(timeoutMs, TimeUnit.MILLISECONDS)
                .readTimeout(timeoutMs, TimeUnit.MILLISECONDS)
                .build();
    }

    @Override
    public CompletableFuture<String> enhance(EnhancementRequest request) {
        PromptForgeProperties.EnhancementProperties config = properties.getEnhancement();
        String body;
        try {
            body = objectMapper.writeValueAsString(new ChatCompletionRequest(
                    config.getModel(),
                    List.of(new ChatMessage("system", systemPrompt(request)),
                            new ChatMessage("user", userPrompt(request))),
                    request.getMaxTokens(),
                    request.getTemperature()));
        } catch (JsonProcessingException e) {
            return CompletableFuture.failedFuture(e);
        }

        Request.Builder requestBuilder = new Request.Builder()
                .url(trimTrailingSlash(config.getApiUrl()) + "/chat/completions")
                .post(RequestBody.create(body, JSON));
        if (config.getApiKey() != null && !config.getApiKey().isBlank()) {
            requestBuilder.header("Authorization", "Bearer " + config.getApiKey());
        }

        Call call = httpClient.newCall(requestBuilder.build());
        CompletableFuture<String> future = new CompletableFuture<>();
        future.whenComplete((text, error) -> {
            if (error != null) {
                call.cancel();
            }
        });

        call.enqueue(new Callback() {
            @Override
            public void onFailure(Call failedCall, IOException e) {
                if (!future.isDone()) {
                    log.warn("[Enhancement] Request error: {}", e.getMessage());
                }
                future.completeExceptionally(e);
            }

            @Override
            public void onResponse(Call completedCall, Response response) {
                try (response) {
                    ResponseBody responseBody = response.body();
                    if (!response.isSuccessful() || responseBody == null) {
                        log.warn("[Enhancement] Request failed: HTTP {}", response.code());
                        future.complete("");
                        return;
                    }
                    future.complete(parseContent(responseBody.string()));
                } catch (IOException e) {
                    future.completeExceptionally(e);
                }
            }
        });
        return future;
    }

    @Override
    public boolean isAvailable() {
        PromptForgeProperties.EnhancementProperties config = properties.getEnhancement();
        return config.getApiUrl() != null && !config.getApiUrl().isBlank();
    }

    private String parseContent(String responseBody) {
        try {
            JsonNode content = objectMapper.readTree(responseBody)
                    .path("choices").path(0).path("message").path("content");
            return content.isTextual() ? content.asText() : "";
        } catch (JsonProcessingException e) {
            log.debug("[Enhancement] Failed to parse completion response");
            return "";
        }
    }

    private String systemPrompt(EnhancementRequest request) {
        StringBuilder sb = new StringBuilder()
                .append("You are an expert at writing prompts for ").append(request.getToolDisplayName())
                .append(". Rewrite prompts so they are specific, actionable and ready to paste into the tool.");
        if (request.getTone() != null && !request.getTone().isBlank()) {
            sb.append(" Use a ").append(request.getTone()).append(" tone.");
        }
        return sb.toString();
    }

    private String userPrompt(EnhancementRequest request) {
        StringBuilder sb = new StringBuilder()
                .append("Enhance this ").append(request.getToolDisplayName())
                .append(" prompt to be more specific and actionable. Keep the project name \"")
                .append(request.getProjectName())
                .append("\" and the existing section structure. Return only the improved prompt.\n");
        if (!request.getGuidelines().isEmpty()) {
            sb.append("\nFollow these guidelines:\n");
            for (String guideline : request.getGuidelines()) {
                sb.append("- ").append(guideline).append("\n");
            }
        }
        sb.append("\nPrompt:\n").append(request.getDraft());
        return sb.toString();
    }

    private static String trimTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    record ChatCompletionRequest(String model, List<ChatMessage> messages, int max_tokens, double temperature) {
    }

    record ChatMessage(String role, String content) {
    }
}
