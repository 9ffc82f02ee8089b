package me.golemcore.promptforge.port.outbound;

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

import me.golemcore.promptforge.domain.model.EnhancementRequest;

import java.util.concurrent.CompletableFuture;

/**
 * Port for the external LLM service that rewrites a composed draft.
 * Implementations complete with an empty string when the service answers with
 * nothing usable. Cancelling the returned future should abort the remote call.
 */
public interface EnhancementPort {

    CompletableFuture<String> enhance(EnhancementRequest request);

    boolean isAvailable();
}
