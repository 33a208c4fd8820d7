package com.evaluate.interviewcoach.dto;

import com.evaluate.interviewcoach.model.InterviewType;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class InterviewTypesDto {
    private List<String> types = Arrays.stream(InterviewType.values())
            .map(InterviewType::getLabel)
            .collect(Collectors.toList());
}
