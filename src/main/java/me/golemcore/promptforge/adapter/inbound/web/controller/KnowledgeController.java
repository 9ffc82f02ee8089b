package me.golemcore.promptforge.adapter.inbound.web.controller;

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
import me.golemcore.promptforge.adapter.inbound.web.dto.KnowledgeResultDto;
import me.golemcore.promptforge.domain.model.CorpusKind;
import me.golemcore.promptforge.domain.model.RetrievalFilters;
import me.golemcore.promptforge.domain.model.RetrievalResult;
import me.golemcore.promptforge.domain.model.TemplateType;
import me.golemcore.promptforge.domain.service.KnowledgeRetrievalService;
import me.golemcore.promptforge.infrastructure.config.PromptForgeProperties;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Locale;

/**
 * Read-only search over the knowledge base. Without a query, entries are
 * ranked by quality score or success rate.
 */
@RestController
@RequestMapping("/api/knowledge")
@RequiredArgsConstructor
public class KnowledgeController {

    private final KnowledgeRetrievalService retrievalService;
    private final PromptForgeProperties properties;

    @GetMapping("/documents")
    public Mono<ResponseEntity<List<KnowledgeResultDto>>> searchDocuments(
            @RequestParam(required = false) String query,
            @RequestParam(required = false) String tool,
            @RequestParam(required = false) String category,
            @RequestParam(required = false) String complexity,
            @RequestParam(required = false) Integer limit) {
        RetrievalFilters.RetrievalFiltersBuilder filters = RetrievalFilters.builder().complexity(complexity);
        if (tool != null && !tool.isBlank()) {
            filters.targetTool(tool);
        }
        if (category != null && !category.isBlank()) {
            filters.category(category);
        }
        PromptForgeProperties.RetrievalProperties retrieval = properties.getRetrieval();
        List<RetrievalResult> results = retrievalService.search(CorpusKind.DOCUMENTS, query, filters.build(),
                retrievalService.documentThreshold(), limit != null ? limit : retrieval.getMaxDocuments());
        return Mono.just(ResponseEntity.ok(results.stream().map(this::toDto).toList()));
    }

    @GetMapping("/templates")
    public Mono<ResponseEntity<List<KnowledgeResultDto>>> searchTemplates(
            @RequestParam(required = false) String query,
            @RequestParam(required = false) String tool,
            @RequestParam(required = false) String type,
            @RequestParam(required = false) Integer limit) {
        RetrievalFilters.RetrievalFiltersBuilder filters = RetrievalFilters.builder();
        if (tool != null && !tool.isBlank()) {
            filters.targetTool(tool);
        }
        if (type != null && !type.isBlank()) {
            filters.templateType(TemplateType.fromValue(type));
        }
        PromptForgeProperties.RetrievalProperties retrieval = properties.getRetrieval();
        List<RetrievalResult> results = retrievalService.search(CorpusKind.TEMPLATES, query, filters.build(),
                retrievalService.templateThreshold(), limit != null ? limit : retrieval.getMaxTemplates());
        return Mono.just(ResponseEntity.ok(results.stream().map(this::toDto).toList()));
    }

    private KnowledgeResultDto toDto(RetrievalResult result) {
        return KnowledgeResultDto.builder()
                .id(result.id())
                .title(result.entry().displayTitle())
                .corpus(result.corpus().name().toLowerCase(Locale.ROOT))
                .similarityScore(result.similarityScore())
                .rankingScore(result.entry().rankingScore())
                .usageCount(result.entry().usageCount())
                .content(result.entry().getContent())
                .build();
    }
}
