package me.golemcore.promptforge.infrastructure.http;

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

import me.golemcore.promptforge.infrastructure.config.PromptForgeProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import okhttp3.ConnectionPool;
import okhttp3.Dispatcher;
import okhttp3.OkHttpClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

/**
 * Shared OkHttp client for outbound calls.
 *
 * <p>
 * Connection failures are not retried: an enhancement request is sent at most
 * once per draft. The dispatcher caps concurrent asynchronous calls at
 * {@code promptforge.http.max-requests}; adapters that need a tighter timeout
 * derive their own client with {@link OkHttpClient#newBuilder()}, which keeps
 * the pool and dispatcher shared.
 *
 * @since 1.0
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class OkHttpConfig {

    private final PromptForgeProperties properties;

    @Bean
    public OkHttpClient okHttpClient() {
        PromptForgeProperties.HttpProperties http = properties.getHttp();

        Dispatcher dispatcher = new Dispatcher();
        dispatcher.setMaxRequests(http.getMaxRequests());
        dispatcher.setMaxRequestsPerHost(http.getMaxRequests());

        log.debug("[HTTP] Client: connect={}ms read={}ms maxRequests={}", http.getConnectTimeout(),
                http.getReadTimeout(), http.getMaxRequests());
        return new OkHttpClient.Builder()
                .dispatcher(dispatcher)
                .connectTimeout(http.getConnectTimeout(), TimeUnit.MILLISECONDS)
                .readTimeout(http.getReadTimeout(), TimeUnit.MILLISECONDS)
                .writeTimeout(http.getWriteTimeout(), TimeUnit.MILLISECONDS)
                .connectionPool(new ConnectionPool(
                        http.getMaxIdleConnections(),
                        http.getKeepAliveDuration(),
                        TimeUnit.MILLISECONDS))
                .retryOnConnectionFailure(false)
                .build();
    }
}
