package com.evaluate.interviewcoach.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;

/**
 * Thin client for the Ollama generate endpoint. An unreachable or failing model is reported
 * as an empty result so that callers can fall back to their deterministic implementation.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class OllamaClient {

    private final WebClient ollamaWebClient;

    @Value("${ollama.model:llama3.2}")
    private String model;

    @Value("${ollama.timeout:60s}")
    private Duration timeout;

    public Optional<String> generate(String prompt) {
        Map<String, Object> body = Map.of(
                "model", model,
                "prompt", prompt,
                "stream", false
        );

        try {
            @SuppressWarnings("unchecked")
            Map<String, Object> result = ollamaWebClient.post()
                    .uri("/api/generate")
                    .bodyValue(body)
                    .retrieve()
                    .bodyToMono(Map.class)
                    .timeout(timeout)
                    .onErrorResume(e -> {
                        log.warn("Ollama not available: {}", e.getMessage());
                        return Mono.empty();
                    })
                    .block();

            if (result == null) {
                return Optional.empty();
            }
            Object response = result.get("response");
            if (response == null || response.toString().isBlank()) {
                log.warn("Ollama returned an empty response for model {}", model);
                return Optional.empty();
            }
            return Optional.of(response.toString());
        } catch (RuntimeException e) {
            log.warn("Error calling Ollama: {}", e.getMessage());
            return Optional.empty();
        }
    }
}
