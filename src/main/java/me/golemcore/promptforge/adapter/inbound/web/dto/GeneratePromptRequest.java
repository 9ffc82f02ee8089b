package me.golemcore.promptforge.adapter.inbound.web.dto;

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

import com.fasterxml.jackson.annotation.JsonAlias;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import me.golemcore.promptforge.domain.model.AppIdea;
import me.golemcore.promptforge.domain.model.ValidationAnswers;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GeneratePromptRequest {
    @JsonAlias("app_idea")
    private AppIdea appIdea;
    @JsonAlias("validation_answers")
    private ValidationAnswers validationAnswers;
    @JsonAlias({ "target_tool", "tool" })
    private String targetTool;
    private String stage;
}
