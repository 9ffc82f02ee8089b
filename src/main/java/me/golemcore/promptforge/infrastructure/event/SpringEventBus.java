package me.golemcore.promptforge.infrastructure.event;

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
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Publishes domain events, such as generation analytics, through Spring's
 * ApplicationEventPublisher.
 *
 * <p>
 * Publishing is fire-and-forget for the caller: a synchronous listener that
 * throws is logged and does not propagate into the generation pipeline.
 * Listeners annotated with {@code @Async} run off the publishing thread.
 *
 * @since 1.0
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SpringEventBus {

    private final ApplicationEventPublisher eventPublisher;

    /**
     * @return true if every synchronous listener accepted the event
     */
    public boolean publish(Object event) {
        String type = event.getClass().getSimpleName();
        try {
            eventPublisher.publishEvent(event);
            log.trace("[Events] Published {}", type);
            return true;
        } catch (RuntimeException e) {
            log.warn("[Events] Listener failed for {}: {}", type, e.getMessage());
            return false;
        }
    }
}
