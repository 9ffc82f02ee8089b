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
import me.golemcore.promptforge.domain.model.KnowledgeDocument;
import me.golemcore.promptforge.domain.model.KnowledgeEntry;
import me.golemcore.promptforge.domain.model.PromptTemplate;
import me.golemcore.promptforge.infrastructure.config.PromptForgeProperties;
import me.golemcore.promptforge.port.outbound.EmbeddingPort;
import me.golemcore.promptforge.port.outbound.KnowledgeStorePort;
import org.springframework.stereotype.Service;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Adds documents and templates to the knowledge base.
 *
 * <p>
 * Content is hashed with SHA-256 and an entry whose hash is already stored is
 * skipped. Entries are embedded from their title and content; when the
 * embedding fails the entry is stored anyway and stays reachable through
 * categorical ranking.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class KnowledgeIngestionService {

    private static final int ID_HASH_LENGTH = 12;

    private final KnowledgeStorePort knowledgeStore;
    private final EmbeddingPort embeddingPort;
    private final PromptForgeProperties properties;

    /**
     * @return true if the document was stored, false if it was a duplicate
     */
    public boolean ingestDocument(KnowledgeDocument document) {
        requireContent(document.getContent(), document.getTitle());
        String hash = ContentHashSupport.sha256(document.getContent());
        if (knowledgeStore.existsByContentHash(CorpusKind.DOCUMENTS, hash)) {
            log.debug("[Knowledge] Document '{}' already stored", document.getTitle());
            return false;
        }
        document.setContentHash(hash);
        if (document.getId() == null || document.getId().isBlank()) {
            document.setId("doc-" + hash.substring(0, ID_HASH_LENGTH));
        }
        document.setEmbedding(embed(document, document.getTitle() + "\n" + document.getContent()));
        return store(document);
    }

    /**
     * @return true if the template was stored, false if it was a duplicate
     */
    public boolean ingestTemplate(PromptTemplate template) {
        requireContent(template.getContent(), template.getName());
        String hash = ContentHashSupport.sha256(template.getContent());
        if (knowledgeStore.existsByContentHash(CorpusKind.TEMPLATES, hash)) {
            log.debug("[Knowledge] Template '{}' already stored", template.getName());
            return false;
        }
        template.setContentHash(hash);
        if (template.getId() == null || template.getId().isBlank()) {
            template.setId("tpl-" + hash.substring(0, ID_HASH_LENGTH));
        }
        String useCase = template.getUseCase() != null ? template.getUseCase() : "";
        template.setEmbedding(embed(template, template.getName() + "\n" + useCase + "\n" + template.getContent()));
        return store(template);
    }

    private boolean store(KnowledgeEntry entry) {
        boolean saved = knowledgeStore.save(entry);
        if (saved) {
            log.debug("[Knowledge] Stored {} entry {}", entry.corpus(), entry.getId());
        }
        return saved;
    }

    private float[] embed(KnowledgeEntry entry, String text) {
        try {
            return embeddingPort.embed(text)
                    .get(properties.getRetrieval().getEmbeddingTimeoutMs(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[Knowledge] Interrupted while embedding {}", entry.getId());
            return null;
        } catch (ExecutionException | TimeoutException | RuntimeException e) {
            log.warn("[Knowledge] Embedding failed for {}, storing without vector: {}", entry.getId(),
                    e.getMessage());
            return null;
        }
    }

    private static void requireContent(String content, String title) {
        if (content == null || content.isBlank()) {
            throw new IllegalArgumentException("Knowledge entry '" + title + "' has no content");
        }
    }
}
