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
import me.golemcore.promptforge.adapter.inbound.web.dto.GeneratePromptRequest;
import me.golemcore.promptforge.adapter.inbound.web.dto.ValidatePromptRequest;
import me.golemcore.promptforge.domain.model.GeneratedPrompt;
import me.golemcore.promptforge.domain.model.ValidationResult;
import me.golemcore.promptforge.domain.service.PromptGenerationService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * Prompt generation and validation endpoints. Disposing the response (for
 * example when the client disconnects) cancels the generation request.
 */
@RestController
@RequestMapping("/api/prompts")
@RequiredArgsConstructor
public class PromptGenerationController {

    private final PromptGenerationService generationService;

    @PostMapping("/generate")
    public Mono<ResponseEntity<GeneratedPrompt>> generate(@RequestBody GeneratePromptRequest request) {
        return Mono.fromFuture(() -> generationService.generate(
                request.getAppIdea(),
                request.getValidationAnswers(),
                request.getTargetTool(),
                request.getStage()))
                .map(ResponseEntity::ok);
    }

    @PostMapping("/validate")
    public Mono<ResponseEntity<ValidationResult>> validate(@RequestBody ValidatePromptRequest request) {
        ValidationResult result = generationService.validate(request.getText(), request.getTargetTool(),
                request.getProjectName());
        return Mono.just(ResponseEntity.ok(result));
    }
}
