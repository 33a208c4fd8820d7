package com.evaluate.interviewcoach.service.extraction;

/**
 * Speech to text for spoken answers. Implementations return an empty string instead of
 * failing, so an unintelligible recording is scored like an empty answer.
 */
public interface TranscriptionService {

    String transcribe(byte[] audio);
}
