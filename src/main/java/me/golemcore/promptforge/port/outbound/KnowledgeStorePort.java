package me.golemcore.promptforge.port.outbound;

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

import me.golemcore.promptforge.domain.model.CorpusKind;
import me.golemcore.promptforge.domain.model.KnowledgeEntry;

import java.util.Collection;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Port for the vector store that holds reference documents and prompt
 * templates.
 */
public interface KnowledgeStorePort {

    /**
     * Load every active entry of a corpus together with its embedding.
     */
    CompletableFuture<List<KnowledgeEntry>> findActive(CorpusKind corpus);

    /**
     * Increment the usage counter of each entry once. Callers do not wait for the
     * result.
     */
    CompletableFuture<Void> recordRetrieval(CorpusKind corpus, Collection<String> ids);

    /**
     * Store an entry. Returns false when an entry with the same content hash
     * already exists in that corpus.
     */
    boolean save(KnowledgeEntry entry);

    boolean existsByContentHash(CorpusKind corpus, String contentHash);

    int count(CorpusKind corpus);
}
