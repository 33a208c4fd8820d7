package com.evaluate.interviewcoach.service.extraction;

import com.evaluate.interviewcoach.exception.ExtractionFailureException;
import com.evaluate.interviewcoach.exception.UnsupportedFormatException;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class DocumentTextReaderTest {

    private final DocumentTextReader reader = new DocumentTextReader();

    @Test
    void plainTextIsDecodedAsUtf8() {
        byte[] content = "Skills: Python, Résumé parsing".getBytes(StandardCharsets.UTF_8);

        assertEquals("Skills: Python, Résumé parsing", reader.read(content, DocumentFormat.TEXT));
    }

    @Test
    void emptyDocumentFails() {
        assertThrows(ExtractionFailureException.class, () -> reader.read(new byte[0], DocumentFormat.PDF));
    }

    @Test
    void missingFormatIsRejected() {
        assertThrows(UnsupportedFormatException.class, () -> reader.read("text".getBytes(StandardCharsets.UTF_8), null));
    }

    @Test
    void contentThatDoesNotMatchTheDeclaredFormatIsRejected() {
        byte[] content = "just some plain words".getBytes(StandardCharsets.UTF_8);

        assertThrows(UnsupportedFormatException.class, () -> reader.read(content, DocumentFormat.PDF));
        assertThrows(UnsupportedFormatException.class, () -> reader.read(content, DocumentFormat.DOCX));
    }

    @Test
    void formatsResolveFromValuesAndFilenames() {
        assertEquals(DocumentFormat.TEXT, DocumentFormat.fromValue("txt"));
        assertEquals(DocumentFormat.DOCX, DocumentFormat.fromValue(" DOCX "));
        assertEquals(DocumentFormat.PDF, DocumentFormat.fromFilename("Resume.PDF"));
        assertThrows(UnsupportedFormatException.class, () -> DocumentFormat.fromValue("rtf"));
        assertThrows(UnsupportedFormatException.class, () -> DocumentFormat.fromFilename("resume.odt"));
    }
}
