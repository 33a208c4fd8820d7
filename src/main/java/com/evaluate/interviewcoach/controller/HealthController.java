package com.evaluate.interviewcoach.controller;

import com.evaluate.interviewcoach.config.InterviewProperties;
import com.evaluate.interviewcoach.service.SessionEngine;
import com.evaluate.interviewcoach.service.extraction.SpeechTranscriptionService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/health")
@RequiredArgsConstructor
public class HealthController {

    private final InterviewProperties properties;
    private final SpeechTranscriptionService transcriptionService;
    private final SessionEngine sessionEngine;

    @GetMapping({"", "/"})
    public Map<String, String> healthCheck() {
        return Map.of(
                "status", "healthy",
                "service", "Interview Coach API",
                "version", "1.0.0"
        );
    }

    @GetMapping("/ready")
    public Map<String, Object> readinessCheck() {
        return Map.of(
                "status", "ready",
                "active_sessions", sessionEngine.activeSessionCount(),
                "dependencies", Map.of(
                        "ollama", properties.getLlm().isEnabled() ? "enabled" : "disabled",
                        "azure_speech", transcriptionService.isAvailable() ? "enabled" : "disabled"
                )
        );
    }
}
