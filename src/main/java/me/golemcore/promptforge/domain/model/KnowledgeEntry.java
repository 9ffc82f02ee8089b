package me.golemcore.promptforge.domain.model;

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

/**
 * Read contract shared by reference documents and prompt templates, so a
 * single retrieval routine can search either corpus.
 */
public interface KnowledgeEntry {

    String getId();

    String getContent();

    String getContentHash();

    float[] getEmbedding();

    boolean isActive();

    CorpusKind corpus();

    /**
     * Human-readable title used when attributing an excerpt.
     */
    String displayTitle();

    /**
     * Score used to order entries when no similarity is available: quality for
     * documents, success rate for templates.
     */
    double rankingScore();

    long usageCount();

    /**
     * Whether this entry satisfies every categorical filter that is set.
     */
    boolean matches(RetrievalFilters filters);
}
