package com.evaluate.interviewcoach.service.extraction;

import com.evaluate.interviewcoach.exception.UnsupportedFormatException;

import java.util.Locale;
import java.util.Set;

public enum DocumentFormat {
    PDF(Set.of("application/pdf"), ".pdf"),
    DOCX(Set.of("application/vnd.openxmlformats-officedocument.wordprocessingml.document",
            "application/x-tika-ooxml"), ".docx"),
    TEXT(Set.of("text/plain"), ".txt");

    private final Set<String> mediaTypes;
    private final String extension;

    DocumentFormat(Set<String> mediaTypes, String extension) {
        this.mediaTypes = mediaTypes;
        this.extension = extension;
    }

    public boolean accepts(String mediaType) {
        return mediaType != null && mediaTypes.contains(mediaType);
    }

    public static DocumentFormat fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new UnsupportedFormatException("Document format is required");
        }
        switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "pdf":
                return PDF;
            case "docx":
                return DOCX;
            case "txt":
            case "text":
                return TEXT;
            default:
                throw new UnsupportedFormatException("Unsupported document format: " + value);
        }
    }

    public static DocumentFormat fromFilename(String filename) {
        if (filename != null) {
            String lower = filename.toLowerCase(Locale.ROOT);
            for (DocumentFormat format : values()) {
                if (lower.endsWith(format.extension)) {
                    return format;
                }
            }
        }
        throw new UnsupportedFormatException("Unsupported file: " + filename + " (expected .pdf, .docx or .txt)");
    }
}
