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
import me.golemcore.promptforge.adapter.inbound.web.dto.StrategyDto;
import me.golemcore.promptforge.adapter.inbound.web.dto.ToolProfileDto;
import me.golemcore.promptforge.domain.model.CommonPitfall;
import me.golemcore.promptforge.domain.model.PromptingStrategy;
import me.golemcore.promptforge.domain.model.ToolProfile;
import me.golemcore.promptforge.domain.service.PromptGenerationService;
import me.golemcore.promptforge.domain.service.ToolProfileRegistry;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Tool profile discovery endpoints.
 */
@RestController
@RequestMapping("/api/tools")
@RequiredArgsConstructor
public class ToolsController {

    private final ToolProfileRegistry toolProfileRegistry;
    private final PromptGenerationService generationService;

    @GetMapping
    public Mono<ResponseEntity<List<ToolProfileDto>>> listTools() {
        List<ToolProfileDto> tools = generationService.listTools().stream()
                .map(toolProfileRegistry::getProfile)
                .map(this::toSummaryDto)
                .toList();
        return Mono.just(ResponseEntity.ok(tools));
    }

    @GetMapping("/{id}")
    public Mono<ResponseEntity<ToolProfileDto>> getTool(@PathVariable String id) {
        ToolProfile profile = requireProfile(id);
        return Mono.just(ResponseEntity.ok(toDetailDto(profile)));
    }

    @GetMapping("/{id}/strategies")
    public Mono<ResponseEntity<List<StrategyDto>>> listStrategies(@PathVariable String id,
            @RequestParam(required = false) String stage) {
        requireProfile(id);
        List<StrategyDto> strategies = generationService.listStrategies(id, stage).stream()
                .map(this::toStrategyDto)
                .toList();
        return Mono.just(ResponseEntity.ok(strategies));
    }

    private ToolProfile requireProfile(String id) {
        return toolProfileRegistry.findProfile(id)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Tool '" + id + "' not found"));
    }

    private ToolProfileDto toSummaryDto(ToolProfile profile) {
        return ToolProfileDto.builder()
                .id(profile.getId())
                .displayName(profile.getDisplayName())
                .description(profile.getDescription())
                .category(profile.getCategory() != null ? profile.getCategory().getValue() : null)
                .complexityTier(profile.getComplexityTier() != null ? profile.getComplexityTier().getValue() : null)
                .build();
    }

    private ToolProfileDto toDetailDto(ToolProfile profile) {
        ToolProfileDto dto = toSummaryDto(profile);
        dto.setOutputFormat(profile.getOutputFormat());
        dto.setTone(profile.getTone());
        dto.setStrategies(profile.rankedStrategies().stream().map(this::toStrategyDto).toList());
        dto.setConstraints(profile.getConstraints());
        dto.setOptimizationTips(profile.getOptimizationTips());
        dto.setGuidelines(profile.getGuidelines());
        dto.setCommonPitfalls(profile.getCommonPitfalls().stream().map(CommonPitfall::getName).toList());
        return dto;
    }

    private StrategyDto toStrategyDto(PromptingStrategy strategy) {
        return StrategyDto.builder()
                .kind(strategy.getKind().getValue())
                .effectivenessScore(strategy.getEffectivenessScore())
                .useCases(strategy.getUseCases())
                .template(strategy.getTemplate())
                .build();
    }
}
