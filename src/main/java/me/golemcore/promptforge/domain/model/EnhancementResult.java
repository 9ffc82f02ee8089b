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

import lombok.Value;

/**
 * Text produced by the enhancement step. When {@code applied} is false the
 * text is the unchanged draft and {@code skipReason} says why.
 */
@Value
public class EnhancementResult {

    String text;
    boolean applied;
    EnhancementSkipReason skipReason;

    public static EnhancementResult applied(String text) {
        return new EnhancementResult(text, true, null);
    }

    public static EnhancementResult skipped(String draft, EnhancementSkipReason reason) {
        return new EnhancementResult(draft, false, reason);
    }
}
