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

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import jakarta.annotation.PostConstruct;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.promptforge.domain.model.KnowledgeDocument;
import me.golemcore.promptforge.domain.model.PromptTemplate;
import me.golemcore.promptforge.domain.service.KnowledgeIngestionService;
import me.golemcore.promptforge.infrastructure.config.PromptForgeProperties;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.function.BooleanSupplier;

/**
 * Loads the bundled knowledge corpus into the store at startup. A missing or
 * unreadable seed file leaves that corpus empty; retrieval then degrades to
 * empty results instead of failing.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class KnowledgeSeedLoader {

    private final PromptForgeProperties properties;
    private final ResourceLoader resourceLoader;
    private final KnowledgeIngestionService ingestionService;

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory())
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    @PostConstruct
    public void init() {
        PromptForgeProperties.KnowledgeProperties knowledge = properties.getKnowledge();
        if (!knowledge.isSeedEnabled()) {
            log.info("[Knowledge] Seeding disabled");
            return;
        }
        int documents = 0;
        for (KnowledgeDocument document : read(knowledge.getDocumentsLocation()).getDocuments()) {
            if (ingest(() -> ingestionService.ingestDocument(document), document.getTitle())) {
                documents++;
            }
        }
        int templates = 0;
        for (PromptTemplate template : read(knowledge.getTemplatesLocation()).getTemplates()) {
            if (ingest(() -> ingestionService.ingestTemplate(template), template.getName())) {
                templates++;
            }
        }
        log.info("[Knowledge] Seeded {} documents and {} templates", documents, templates);
    }

    private boolean ingest(BooleanSupplier action, String name) {
        try {
            return action.getAsBoolean();
        } catch (IllegalArgumentException e) {
            log.warn("[Knowledge] Skipping seed entry '{}': {}", name, e.getMessage());
            return false;
        }
    }

    SeedFile read(String location) {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            log.warn("[Knowledge] Seed file not found: {}", location);
            return new SeedFile();
        }
        try (InputStream in = resource.getInputStream()) {
            SeedFile file = yamlMapper.readValue(in, SeedFile.class);
            return file != null ? file : new SeedFile();
        } catch (IOException e) {
            log.error("[Knowledge] Failed to read seed file {}: {}", location, e.getMessage());
            return new SeedFile();
        }
    }

    @Data
    static class SeedFile {
        private List<KnowledgeDocument> documents = new ArrayList<>();
        private List<PromptTemplate> templates = new ArrayList<>();
    }
}
