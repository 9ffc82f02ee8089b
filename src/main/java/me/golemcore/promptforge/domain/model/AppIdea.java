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

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Application idea as captured upstream by the wizard. Fields are loosely typed
 * and may be missing.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class AppIdea {

    @JsonAlias({ "app_name", "name" })
    private String appName;

    @JsonAlias({ "idea_description", "app_description", "description" })
    private String ideaDescription;

    @Builder.Default
    private List<String> platforms = new ArrayList<>();

    @JsonAlias({ "design_style", "style" })
    private String designStyle;

    @JsonAlias("style_description")
    private String styleDescription;

    @JsonAlias({ "target_audience", "target_users" })
    private String targetAudience;
}
