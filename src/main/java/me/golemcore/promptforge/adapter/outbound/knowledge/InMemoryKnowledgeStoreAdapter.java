package me.golemcore.promptforge.adapter.outbound.knowledge;

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
import me.golemcore.promptforge.domain.model.CorpusKind;
import me.golemcore.promptforge.domain.model.KnowledgeDocument;
import me.golemcore.promptforge.domain.model.KnowledgeEntry;
import me.golemcore.promptforge.domain.model.PromptTemplate;
import me.golemcore.promptforge.port.outbound.KnowledgeStorePort;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory vector store for the knowledge base.
 *
 * <p>
 * Each corpus is a thread-safe map keyed by entry id, with a second index on
 * content hash that keeps entries unique. Similarity ranking happens in the
 * retrieval service; this store only serves active entries with their
 * embeddings and keeps the usage counters.
 */
@Component
@Slf4j
public class InMemoryKnowledgeStoreAdapter implements KnowledgeStorePort {

    private final Map<CorpusKind, Map<String, KnowledgeEntry>> entries = new EnumMap<>(CorpusKind.class);
    private final Map<CorpusKind, Map<String, String>> idsByHash = new EnumMap<>(CorpusKind.class);

    public InMemoryKnowledgeStoreAdapter() {
        for (CorpusKind corpus : CorpusKind.values()) {
            entries.put(corpus, new ConcurrentHashMap<>());
            idsByHash.put(corpus, new ConcurrentHashMap<>());
        }
    }

    @Override
    public CompletableFuture<List<KnowledgeEntry>> findActive(CorpusKind corpus) {
        List<KnowledgeEntry> active = entries.get(corpus).values().stream()
                .filter(KnowledgeEntry::isActive)
                .toList();
        return CompletableFuture.completedFuture(active);
    }

    @Override
    public CompletableFuture<Void> recordRetrieval(CorpusKind corpus, Collection<String> ids) {
        Map<String, KnowledgeEntry> corpusEntries = entries.get(corpus);
        for (String id : Set.copyOf(ids)) {
            KnowledgeEntry entry = corpusEntries.get(id);
            if (entry instanceof KnowledgeDocument document) {
                document.incrementRetrievalCount();
            } else if (entry instanceof PromptTemplate template) {
                template.incrementUsageCount();
            }
        }
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public boolean save(KnowledgeEntry entry) {
        CorpusKind corpus = entry.corpus();
        String existing = idsByHash.get(corpus).putIfAbsent(entry.getContentHash(), entry.getId());
        if (existing != null) {
            log.debug("[Knowledge] Skipping duplicate {} entry {} (same content as {})", corpus, entry.getId(),
                    existing);
            return false;
        }
        entries.get(corpus).put(entry.getId(), entry);
        return true;
    }

    @Override
    public boolean existsByContentHash(CorpusKind corpus, String contentHash) {
        return idsByHash.get(corpus).containsKey(contentHash);
    }

    @Override
    public int count(CorpusKind corpus) {
        return entries.get(corpus).size();
    }
}
