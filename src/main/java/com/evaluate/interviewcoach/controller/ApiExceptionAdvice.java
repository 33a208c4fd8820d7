package com.evaluate.interviewcoach.controller;

import com.evaluate.interviewcoach.exception.InterviewCoachException;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maps coach exceptions to JSON error bodies with the status carried by their error code.
 */
@Slf4j
@RestControllerAdvice(annotations = RestController.class)
public class ApiExceptionAdvice {

    @ExceptionHandler(InterviewCoachException.class)
    public ResponseEntity<Map<String, Object>> handleCoachException(InterviewCoachException ex,
                                                                    HttpServletRequest request) {
        HttpStatus status = ex.getCode().getStatus();
        if (status.is5xxServerError()) {
            log.error("{} {} failed: {}", request.getMethod(), request.getRequestURI(), ex.getMessage(), ex);
        } else {
            log.info("{} {} rejected: {} {}", request.getMethod(), request.getRequestURI(), ex.getCode(), ex.getMessage());
        }
        return ResponseEntity.status(status).body(body(status, ex.getCode().name(), ex.getMessage(), request));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(MethodArgumentNotValidException ex,
                                                                HttpServletRequest request) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .map(FieldError::getField)
                .distinct()
                .collect(Collectors.joining(", ", "Missing or invalid fields: ", ""));
        HttpStatus status = HttpStatus.BAD_REQUEST;
        return ResponseEntity.status(status).body(body(status, "VALIDATION_FAILED", message, request));
    }

    @ExceptionHandler({MissingServletRequestParameterException.class, MissingServletRequestPartException.class})
    public ResponseEntity<Map<String, Object>> handleMissingInput(Exception ex, HttpServletRequest request) {
        HttpStatus status = HttpStatus.BAD_REQUEST;
        return ResponseEntity.status(status).body(body(status, "VALIDATION_FAILED", ex.getMessage(), request));
    }

    private static Map<String, Object> body(HttpStatus status, String code, String message, HttpServletRequest request) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("timestamp", Instant.now().toString());
        out.put("status", status.value());
        out.put("error", status.getReasonPhrase());
        out.put("code", code);
        out.put("message", message);
        out.put("path", request.getRequestURI());
        return out;
    }
}
