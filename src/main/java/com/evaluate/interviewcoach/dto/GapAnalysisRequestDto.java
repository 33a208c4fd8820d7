package com.evaluate.interviewcoach.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class GapAnalysisRequestDto {
    private String resumeText;
    @NotBlank
    private String jobDescriptionText;
}
