package me.golemcore.promptforge.adapter.outbound.analytics;

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
import me.golemcore.promptforge.domain.model.GenerationAnalyticsEvent;
import me.golemcore.promptforge.infrastructure.event.SpringEventBus;
import me.golemcore.promptforge.port.outbound.AnalyticsPort;
import org.springframework.stereotype.Component;

/**
 * Publishes generation analytics on the application event bus.
 *
 * @see GenerationAnalyticsListener
 */
@Component
@RequiredArgsConstructor
public class SpringEventAnalyticsAdapter implements AnalyticsPort {

    private final SpringEventBus eventBus;

    @Override
    public void publish(GenerationAnalyticsEvent event) {
        eventBus.publish(event);
    }
}
