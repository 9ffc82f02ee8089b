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
import me.golemcore.promptforge.domain.model.CorpusKind;
import me.golemcore.promptforge.domain.model.KnowledgeEntry;
import me.golemcore.promptforge.domain.model.RetrievalFilters;
import me.golemcore.promptforge.domain.model.RetrievalResult;
import me.golemcore.promptforge.infrastructure.config.PromptForgeProperties;
import me.golemcore.promptforge.port.outbound.EmbeddingPort;
import me.golemcore.promptforge.port.outbound.KnowledgeStorePort;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.BooleanSupplier;

/**
 * Similarity search over the knowledge base.
 *
 * <p>
 * Both corpora are searched by the same routine:
 * <ol>
 * <li>load the active entries and apply the categorical filters</li>
 * <li>embed the query and score every entry by cosine similarity, clamped to
 * [0, 1]</li>
 * <li>drop entries under the threshold, sort by descending similarity and
 * truncate</li>
 * </ol>
 * Without query text, or when the embedding cannot be computed, results are
 * ranked by quality score (documents) or success rate (templates) with a
 * similarity of zero. A failing store yields an empty list.
 *
 * <p>
 * Default thresholds depend on the active embedding provider, see
 * {@link PromptForgeProperties.RetrievalProperties#documentThresholdFor}.
 * Usage counters are bumped once per returned entry, without waiting for the
 * store, unless the caller abandoned the search before it finished.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class KnowledgeRetrievalService {

    private static final Comparator<RetrievalResult> BY_SIMILARITY = Comparator
            .comparingDouble(RetrievalResult::similarityScore).reversed()
            .thenComparing(RetrievalResult::id);

    private static final Comparator<KnowledgeEntry> BY_RANKING = Comparator
            .comparingDouble(KnowledgeEntry::rankingScore).reversed()
            .thenComparing(KnowledgeEntry::getId);

    private final KnowledgeStorePort knowledgeStore;
    private final EmbeddingPort embeddingPort;
    private final PromptForgeProperties properties;

    public List<RetrievalResult> searchDocuments(String queryText, RetrievalFilters filters) {
        return searchDocuments(queryText, filters, () -> false);
    }

    /**
     * Document search whose usage is only recorded while {@code abandoned}
     * reports false.
     */
    public List<RetrievalResult> searchDocuments(String queryText, RetrievalFilters filters,
            BooleanSupplier abandoned) {
        return search(CorpusKind.DOCUMENTS, queryText, filters, documentThreshold(),
                properties.getRetrieval().getMaxDocuments(), abandoned);
    }

    public List<RetrievalResult> searchTemplates(String queryText, RetrievalFilters filters) {
        return searchTemplates(queryText, filters, () -> false);
    }

    public List<RetrievalResult> searchTemplates(String queryText, RetrievalFilters filters,
            BooleanSupplier abandoned) {
        return search(CorpusKind.TEMPLATES, queryText, filters, templateThreshold(),
                properties.getRetrieval().getMaxTemplates(), abandoned);
    }

    /**
     * Default document threshold for the active embedding provider.
     */
    public double documentThreshold() {
        return properties.getRetrieval().documentThresholdFor(embeddingPort.getProviderId());
    }

    public double templateThreshold() {
        return properties.getRetrieval().templateThresholdFor(embeddingPort.getProviderId());
    }

    /**
     * Searches one corpus. Never throws: store and embedding failures degrade the
     * result instead.
     *
     * @param corpus
     *            which corpus to search
     * @param queryText
     *            free text to embed, or null for categorical-only ranking
     * @param filters
     *            categorical filters, null for none
     * @param threshold
     *            minimum similarity, clamped to [0, 1]
     * @param maxResults
     *            upper bound on the result size
     * @return results sorted by descending similarity
     */
    public List<RetrievalResult> search(CorpusKind corpus, String queryText, RetrievalFilters filters,
            double threshold, int maxResults) {
        return search(corpus, queryText, filters, threshold, maxResults, () -> false);
    }

    private List<RetrievalResult> search(CorpusKind corpus, String queryText, RetrievalFilters filters,
            double threshold, int maxResults, BooleanSupplier abandoned) {
        if (maxResults <= 0) {
            return List.of();
        }
        RetrievalFilters effectiveFilters = filters != null ? filters : RetrievalFilters.none();

        List<KnowledgeEntry> candidates = loadCandidates(corpus, effectiveFilters);
        if (candidates.isEmpty()) {
            return List.of();
        }

        List<RetrievalResult> results;
        float[] queryEmbedding = queryText == null || queryText.isBlank() ? null : embedQuery(corpus, queryText);
        if (queryEmbedding == null) {
            results = rankByScore(corpus, candidates, maxResults);
        } else {
            results = rankBySimilarity(corpus, candidates, queryEmbedding, clamp(threshold), maxResults);
        }

        if (abandoned.getAsBoolean()) {
            log.debug("[Retrieval] {} search abandoned by caller, usage not recorded", corpus);
            return results;
        }
        recordRetrieval(corpus, results);
        log.debug("[Retrieval] {} search returned {} of {} candidates", corpus, results.size(), candidates.size());
        return results;
    }

    private List<KnowledgeEntry> loadCandidates(CorpusKind corpus, RetrievalFilters filters) {
        List<KnowledgeEntry> active;
        try {
            active = knowledgeStore.findActive(corpus)
                    .get(properties.getRetrieval().getStoreTimeoutMs(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[Retrieval] Interrupted while loading {}", corpus);
            return List.of();
        } catch (ExecutionException | TimeoutException | RuntimeException e) {
            log.warn("[Retrieval] Knowledge store unavailable for {}, continuing without results: {}",
                    corpus, e.getMessage());
            return List.of();
        }
        if (active == null) {
            return List.of();
        }
        return active.stream()
                .filter(KnowledgeEntry::isActive)
                .filter(entry -> entry.matches(filters))
                .toList();
    }

    private float[] embedQuery(CorpusKind corpus, String queryText) {
        try {
            float[] embedding = embeddingPort.embed(queryText)
                    .get(properties.getRetrieval().getEmbeddingTimeoutMs(), TimeUnit.MILLISECONDS);
            if (embedding == null || embedding.length == 0) {
                log.warn("[Retrieval] Empty query embedding for {}, ranking by score", corpus);
                return null;
            }
            return embedding;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[Retrieval] Interrupted while embedding query for {}", corpus);
            return null;
        } catch (ExecutionException | TimeoutException | RuntimeException e) {
            log.warn("[Retrieval] Query embedding failed for {}, ranking by score: {}", corpus, e.getMessage());
            return null;
        }
    }

    private List<RetrievalResult> rankBySimilarity(CorpusKind corpus, List<KnowledgeEntry> candidates,
            float[] queryEmbedding, double threshold, int maxResults) {
        List<RetrievalResult> scored = new ArrayList<>();
        for (KnowledgeEntry entry : candidates) {
            float[] embedding = entry.getEmbedding();
            if (embedding == null || embedding.length != queryEmbedding.length) {
                continue;
            }
            RetrievalResult result = new RetrievalResult(entry, corpus,
                    embeddingPort.cosineSimilarity(queryEmbedding, embedding));
            if (result.similarityScore() >= threshold) {
                scored.add(result);
            }
        }
        return scored.stream()
                .sorted(BY_SIMILARITY)
                .limit(maxResults)
                .toList();
    }

    private List<RetrievalResult> rankByScore(CorpusKind corpus, List<KnowledgeEntry> candidates,
            int maxResults) {
        return candidates.stream()
                .sorted(BY_RANKING)
                .limit(maxResults)
                .map(entry -> new RetrievalResult(entry, corpus, 0.0))
                .toList();
    }

    private void recordRetrieval(CorpusKind corpus, List<RetrievalResult> results) {
        if (results.isEmpty()) {
            return;
        }
        Set<String> ids = new LinkedHashSet<>();
        for (RetrievalResult result : results) {
            ids.add(result.id());
        }
        try {
            knowledgeStore.recordRetrieval(corpus, ids)
                    .exceptionally(e -> {
                        log.warn("[Retrieval] Failed to record usage for {}: {}", corpus, e.getMessage());
                        return null;
                    });
        } catch (RuntimeException e) {
            log.warn("[Retrieval] Failed to record usage for {}: {}", corpus, e.getMessage());
        }
    }

    private static double clamp(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }
}
