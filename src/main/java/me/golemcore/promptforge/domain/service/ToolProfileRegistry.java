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

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import jakarta.annotation.PostConstruct;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.promptforge.domain.exception.UnsupportedToolException;
import me.golemcore.promptforge.domain.model.CommonPitfall;
import me.golemcore.promptforge.domain.model.ComplexityTier;
import me.golemcore.promptforge.domain.model.PromptStage;
import me.golemcore.promptforge.domain.model.PromptingStrategy;
import me.golemcore.promptforge.domain.model.StrategyKind;
import me.golemcore.promptforge.domain.model.ToolCategory;
import me.golemcore.promptforge.domain.model.ToolProfile;
import me.golemcore.promptforge.infrastructure.config.PromptForgeProperties;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Read-only registry of tool profiles.
 *
 * <p>
 * Profiles are loaded once from the YAML file named by
 * {@code promptforge.profiles.location}. Each profile is validated while
 * loading: it needs an id, a display name, at least one strategy with a score
 * in [0, 1], templates that reference known placeholders only, and pitfall
 * patterns that compile. A file that fails any of these checks stops the
 * application from starting.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ToolProfileRegistry {

    private final PromptForgeProperties properties;
    private final ResourceLoader resourceLoader;
    private final PlaceholderTemplateEngine templateEngine;

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, true);

    private volatile Map<String, ToolProfile> profiles = Map.of();

    @PostConstruct
    public void init() {
        String location = properties.getProfiles().getLocation();
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            throw new IllegalStateException("Tool profile configuration not found: " + location);
        }
        try (InputStream in = resource.getInputStream()) {
            load(in, location);
        } catch (IOException e) {
            throw new IllegalStateException("Cannot read tool profile configuration " + location, e);
        }
    }

    void load(InputStream in, String source) {
        ProfilesFile file;
        try {
            file = yamlMapper.readValue(in, ProfilesFile.class);
        } catch (IOException e) {
            throw new IllegalStateException("Malformed tool profile configuration " + source + ": "
                    + e.getMessage(), e);
        }
        if (file == null || file.getTools() == null || file.getTools().isEmpty()) {
            throw new IllegalStateException("Tool profile configuration " + source + " declares no tools");
        }

        Map<String, ToolProfile> loaded = new LinkedHashMap<>();
        for (ProfileEntry entry : file.getTools()) {
            ToolProfile profile = toProfile(entry);
            if (loaded.putIfAbsent(profile.getId(), profile) != null) {
                throw new IllegalStateException("Duplicate tool profile id: " + profile.getId());
            }
        }
        profiles = Collections.unmodifiableMap(loaded);
        log.info("[Registry] Loaded {} tool profiles from {}: {}", loaded.size(), source, loaded.keySet());
    }

    /**
     * Returns the profile for a tool id.
     *
     * @throws UnsupportedToolException
     *             if no profile is registered under that id
     */
    public ToolProfile getProfile(String toolId) {
        return findProfile(toolId).orElseThrow(() -> new UnsupportedToolException(toolId));
    }

    public Optional<ToolProfile> findProfile(String toolId) {
        if (toolId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(profiles.get(toolId.trim()));
    }

    /**
     * Registered tool ids in declaration order.
     */
    public List<String> listTools() {
        return List.copyOf(profiles.keySet());
    }

    public List<ToolProfile> getAllProfiles() {
        return List.copyOf(profiles.values());
    }

    /**
     * Strategies for a stage, highest effectiveness first. A per-stage template
     * override replaces the skeleton of every returned strategy.
     */
    public List<PromptingStrategy> listStrategiesFor(String toolId, PromptStage stage) {
        ToolProfile profile = getProfile(toolId);
        List<PromptingStrategy> strategies = profile.strategiesFor(stage.getTaskType(), stage);
        Optional<String> override = profile.stageTemplate(stage);
        if (override.isEmpty()) {
            return strategies;
        }
        return strategies.stream()
                .map(strategy -> strategy.toBuilder().template(override.get()).build())
                .toList();
    }

    private ToolProfile toProfile(ProfileEntry entry) {
        String id = requireText(entry.getId(), "id", "<unnamed>");
        String displayName = requireText(entry.getDisplayName(), "displayName", id);
        if (entry.getStrategies() == null || entry.getStrategies().isEmpty()) {
            throw new IllegalStateException("Tool profile '" + id + "' declares no strategies");
        }

        ToolProfile.ToolProfileBuilder builder = ToolProfile.builder()
                .id(id)
                .displayName(displayName)
                .description(entry.getDescription())
                .category(parse(() -> ToolCategory.fromValue(entry.getCategory()), "category", id))
                .complexityTier(parse(() -> ComplexityTier.fromValue(entry.getComplexityTier()),
                        "complexityTier", id))
                .outputFormat(entry.getOutputFormat())
                .tone(entry.getTone())
                .constraints(nullSafe(entry.getConstraints()))
                .optimizationTips(nullSafe(entry.getOptimizationTips()))
                .guidelines(nullSafe(entry.getGuidelines()));

        for (StrategyEntry strategy : entry.getStrategies()) {
            builder.strategy(toStrategy(strategy, id));
        }
        for (PitfallEntry pitfall : nullSafe(entry.getPitfalls())) {
            builder.commonPitfall(toPitfall(pitfall, id));
        }
        if (entry.getStageTemplates() != null) {
            entry.getStageTemplates().forEach((stageId, template) -> {
                PromptStage stage = PromptStage.fromValue(stageId)
                        .orElseThrow(() -> new IllegalStateException(
                                "Tool profile '" + id + "' has a template for unknown stage '" + stageId + "'"));
                checkPlaceholders(template, id);
                builder.stageTemplate(stage, template);
            });
        }
        return builder.build();
    }

    private PromptingStrategy toStrategy(StrategyEntry entry, String toolId) {
        StrategyKind kind = parse(() -> StrategyKind.fromValue(entry.getKind()), "strategy kind", toolId);
        if (kind == null) {
            throw new IllegalStateException("Tool profile '" + toolId + "' has a strategy without kind");
        }
        double score = entry.getEffectiveness();
        if (Double.isNaN(score) || score < 0.0 || score > 1.0) {
            throw new IllegalStateException("Tool profile '" + toolId + "' strategy " + kind.getValue()
                    + " has effectiveness outside [0, 1]: " + score);
        }
        String template = requireText(entry.getTemplate(), "strategy template", toolId);
        checkPlaceholders(template, toolId);
        return PromptingStrategy.builder()
                .kind(kind)
                .template(template)
                .useCases(nullSafe(entry.getUseCases()))
                .effectivenessScore(score)
                .build();
    }

    private CommonPitfall toPitfall(PitfallEntry entry, String toolId) {
        Pattern pattern = null;
        if (entry.getPattern() != null && !entry.getPattern().isBlank()) {
            try {
                pattern = Pattern.compile(entry.getPattern(), Pattern.CASE_INSENSITIVE);
            } catch (PatternSyntaxException e) {
                throw new IllegalStateException("Tool profile '" + toolId + "' pitfall '" + entry.getName()
                        + "' has an invalid pattern", e);
            }
        }
        return CommonPitfall.builder()
                .name(requireText(entry.getName(), "pitfall name", toolId))
                .description(entry.getDescription())
                .pattern(pattern)
                .suggestion(entry.getSuggestion())
                .build();
    }

    private void checkPlaceholders(String template, String toolId) {
        Set<String> used = templateEngine.placeholders(template);
        for (String name : used) {
            if (!PromptVariables.ALL.contains(name)) {
                throw new IllegalStateException("Tool profile '" + toolId + "' uses unknown placeholder {{"
                        + name + "}}");
            }
        }
    }

    private static <T> T parse(Supplier<T> parser, String field, String toolId) {
        try {
            return parser.get();
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("Tool profile '" + toolId + "' has an invalid " + field, e);
        }
    }

    private static String requireText(String value, String field, String toolId) {
        if (value == null || value.isBlank()) {
            throw new IllegalStateException("Tool profile '" + toolId + "' is missing " + field);
        }
        return value;
    }

    private static <T> List<T> nullSafe(List<T> values) {
        return values != null ? values : List.of();
    }

    @Data
    static class ProfilesFile {
        private List<ProfileEntry> tools = new ArrayList<>();
    }

    @Data
    static class ProfileEntry {
        private String id;
        private String displayName;
        private String description;
        private String category;
        private String complexityTier;
        private String outputFormat;
        private String tone;
        private List<StrategyEntry> strategies = new ArrayList<>();
        private List<String> constraints = new ArrayList<>();
        private List<String> optimizationTips = new ArrayList<>();
        private List<String> guidelines = new ArrayList<>();
        private List<PitfallEntry> pitfalls = new ArrayList<>();
        private Map<String, String> stageTemplates = new LinkedHashMap<>();
    }

    @Data
    static class StrategyEntry {
        private String kind;
        private double effectiveness;
        private List<String> useCases = new ArrayList<>();
        private String template;
    }

    @Data
    static class PitfallEntry {
        private String name;
        private String description;
        private String pattern;
        private String suggestion;
    }
}
