package com.evaluate.interviewcoach.service.extraction;

import com.evaluate.interviewcoach.exception.ExtractionFailureException;
import com.evaluate.interviewcoach.exception.UnsupportedFormatException;
import lombok.extern.slf4j.Slf4j;
import org.apache.tika.Tika;
import org.apache.tika.exception.TikaException;
import org.apache.tika.metadata.Metadata;
import org.apache.tika.parser.AutoDetectParser;
import org.apache.tika.parser.ParseContext;
import org.apache.tika.sax.BodyContentHandler;
import org.springframework.stereotype.Component;
import org.xml.sax.SAXException;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

/**
 * Turns an uploaded résumé or job description into plain text.
 */
@Component
@Slf4j
public class DocumentTextReader {

    private final Tika tika = new Tika();

    public String read(byte[] content, DocumentFormat format) {
        if (format == null) {
            throw new UnsupportedFormatException("Document format is required");
        }
        if (content == null || content.length == 0) {
            throw new ExtractionFailureException("Document is empty");
        }
        if (format == DocumentFormat.TEXT) {
            return new String(content, StandardCharsets.UTF_8);
        }

        String detected = tika.detect(content);
        if (!format.accepts(detected)) {
            throw new UnsupportedFormatException("Content was declared " + format + " but looks like " + detected);
        }

        try (InputStream is = new ByteArrayInputStream(content)) {
            AutoDetectParser parser = new AutoDetectParser();
            BodyContentHandler handler = new BodyContentHandler(-1);
            parser.parse(is, handler, new Metadata(), new ParseContext());
            String text = handler.toString();
            if (text.isBlank()) {
                throw new ExtractionFailureException("No text could be extracted from the " + format + " document");
            }
            log.debug("Extracted {} characters from {} document", text.length(), format);
            return text;
        } catch (IOException | TikaException | SAXException e) {
            log.error("Failed to parse {} document", format, e);
            throw new ExtractionFailureException("Unable to parse " + format + " document", e);
        }
    }
}
