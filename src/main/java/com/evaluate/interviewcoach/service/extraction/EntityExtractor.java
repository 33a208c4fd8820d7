package com.evaluate.interviewcoach.service.extraction;

public interface EntityExtractor {

    ExtractedEntities extract(String text);
}
