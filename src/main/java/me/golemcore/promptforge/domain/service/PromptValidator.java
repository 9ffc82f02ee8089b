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
import me.golemcore.promptforge.domain.model.CommonPitfall;
import me.golemcore.promptforge.domain.model.ToolProfile;
import me.golemcore.promptforge.domain.model.ValidationResult;
import me.golemcore.promptforge.infrastructure.config.PromptForgeProperties;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Structural checks on a finished prompt.
 *
 * <p>
 * Blocking issues: the text is shorter than the minimum length, it never
 * names the project, it contains no actionable instruction, or it matches a
 * pitfall pattern of the target tool. Each issue costs a fixed penalty from a
 * score of 100, floored at 0. Excess length, vague wording and pitfall advice
 * are reported as suggestions only.
 */
@Component
@RequiredArgsConstructor
public class PromptValidator {

    private static final int MAX_SCORE = 100;

    private static final Pattern ACTION_MARKER = Pattern.compile(
            "\\b(create|build|implement|design|develop|add|generate|set up|configure|integrate|ensure|include"
                    + "|make|write|fix|optimi[sz]e|refactor)\\b",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern VAGUE_WORDS = Pattern.compile(
            "\\b(nice|good|better|improve|enhance)\\b", Pattern.CASE_INSENSITIVE);

    private final PromptForgeProperties properties;

    /**
     * Generic checks only: no project name echo and no tool pitfalls.
     */
    public ValidationResult validate(String text) {
        return validate(text, null, null);
    }

    public ValidationResult validate(String text, String projectName, ToolProfile profile) {
        PromptForgeProperties.ValidationProperties config = properties.getValidation();
        ValidationResult.ValidationResultBuilder result = ValidationResult.builder();
        String body = text != null ? text : "";
        int issues = 0;

        if (body.strip().length() < config.getMinLength()) {
            result.issue("Prompt is too short (" + body.strip().length() + " characters, minimum "
                    + config.getMinLength() + ")");
            issues++;
        }
        if (projectName != null && !projectName.isBlank()
                && !body.toLowerCase(Locale.ROOT).contains(projectName.trim().toLowerCase(Locale.ROOT))) {
            result.issue("Prompt does not mention the project name '" + projectName.trim() + "'");
            issues++;
        }
        if (!ACTION_MARKER.matcher(body).find()) {
            result.issue("Prompt contains no actionable instruction");
            result.suggestion("Start with a clear action such as \"Create\", \"Build\" or \"Implement\"");
            issues++;
        }
        if (profile != null) {
            for (CommonPitfall pitfall : profile.getCommonPitfalls()) {
                if (pitfall.matches(body)) {
                    result.issue(profile.getDisplayName() + " pitfall: " + pitfall.getName());
                    if (pitfall.getSuggestion() != null) {
                        result.suggestion(pitfall.getSuggestion());
                    }
                    issues++;
                }
            }
        }

        if (body.length() > config.getSoftMaxLength()) {
            result.suggestion("Prompt is very long; consider splitting it into smaller, focused steps");
        }
        if (countVagueWords(body) > config.getVagueWordLimit()) {
            result.suggestion("Replace vague words (nice, good, better) with specific, measurable requirements");
        }

        int score = Math.max(0, MAX_SCORE - issues * config.getPenaltyPerIssue());
        return result
                .valid(issues == 0)
                .score(Math.min(MAX_SCORE, score))
                .build();
    }

    private static int countVagueWords(String text) {
        Matcher matcher = VAGUE_WORDS.matcher(text);
        int count = 0;
        while (matcher.find()) {
            count++;
        }
        return count;
    }
}
