package me.golemcore.promptforge;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableAsync;

/**
 * Main application class for PromptForge.
 *
 * <p>
 * PromptForge turns a structured application idea into a generation-ready
 * prompt for a specific AI development tool (Lovable, Bolt, Cursor, v0, Claude,
 * ChatGPT).
 *
 * <h2>Pipeline</h2>
 * <ul>
 * <li><b>Tool profiles</b> - per-tool strategies, constraints and pitfalls
 * loaded from YAML</li>
 * <li><b>Normalization</b> - wizard answers mapped to requirement lists</li>
 * <li><b>Retrieval</b> - similarity search over reference documents and prompt
 * templates</li>
 * <li><b>Composition</b> - deterministic template filling</li>
 * <li><b>Enhancement</b> - optional rewrite by an OpenAI-compatible LLM</li>
 * <li><b>Scoring</b> - confidence score and structural validation</li>
 * </ul>
 *
 * <h2>Architecture</h2>
 * <p>
 * Hexagonal architecture (Ports & Adapters):
 *
 * <pre>
 * Input Layer        → REST controllers (WebFlux)
 * Domain Layer       → PromptGenerationService and pipeline services
 * Infrastructure     → Knowledge store, embedding, enhancement, analytics adapters
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.properties} under
 * {@code promptforge.*} prefix.
 *
 * @version 1.0
 * @since 1.0
 */
@SpringBootApplication
@ConfigurationPropertiesScan
@EnableAsync
public class PromptForgeApplication {

    public static void main(String[] args) {
        SpringApplication.run(PromptForgeApplication.class, args);
    }

}
