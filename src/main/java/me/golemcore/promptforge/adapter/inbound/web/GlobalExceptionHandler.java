package me.golemcore.promptforge.adapter.inbound.web;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.promptforge.adapter.inbound.web.dto.ApiErrorResponse;
import me.golemcore.promptforge.domain.exception.GenerationFailedException;
import me.golemcore.promptforge.domain.exception.MissingRequiredFieldException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

/**
 * Maps domain failures to HTTP responses: invalid input and unknown tools are
 * caller errors, a failed generation is a server error.
 */
@ControllerAdvice(basePackages = "me.golemcore.promptforge.adapter.inbound.web.controller")
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(ResponseStatusException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleResponseStatus(ResponseStatusException ex) {
        HttpStatus status = HttpStatus.valueOf(ex.getStatusCode().value());
        log.warn("[API] {}: {}", status, ex.getReason());
        return respond(status, ex.getReason(), null);
    }

    @ExceptionHandler(MissingRequiredFieldException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleMissingField(MissingRequiredFieldException ex) {
        log.warn("[API] Bad request: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, ex.getMessage(), ex.getField());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("[API] Bad request: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, ex.getMessage(), null);
    }

    @ExceptionHandler(GenerationFailedException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleGenerationFailed(GenerationFailedException ex) {
        log.error("[API] Generation failed for {}", ex.getToolId(), ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Prompt generation failed", null);
    }

    @ExceptionHandler(Exception.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleGeneric(Exception ex) {
        log.error("[API] Internal server error", ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error", null);
    }

    private Mono<ResponseEntity<ApiErrorResponse>> respond(HttpStatus status, String message, String field) {
        ApiErrorResponse body = ApiErrorResponse.builder()
                .status(status.value())
                .message(message)
                .field(field)
                .build();
        return Mono.just(ResponseEntity.status(status).body(body));
    }
}
