package com.evaluate.interviewcoach.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SessionCreateDto {
    @NotBlank
    private String interviewType;
    private String resumeText;
    private String jobDescriptionText;
    /** Null uses the configured default. */
    private Boolean adaptive;
}
