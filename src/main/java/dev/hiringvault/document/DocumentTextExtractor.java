package dev.hiringvault.document;

import dev.hiringvault.exception.ExtractionFailedException;
import dev.hiringvault.model.SourceDocument;
import lombok.extern.slf4j.Slf4j;
import org.apache.tika.exception.TikaException;
import org.apache.tika.metadata.Metadata;
import org.apache.tika.metadata.TikaCoreProperties;
import org.apache.tika.parser.AutoDetectParser;
import org.apache.tika.parser.ParseContext;
import org.apache.tika.sax.BodyContentHandler;
import org.springframework.stereotype.Service;
import org.xml.sax.SAXException;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;

/**
 * Converts PDF, Word and plain text documents to normalized text with Apache Tika.
 */
@Slf4j
@Service
public class DocumentTextExtractor {

    /**
     * Extract the text of a document.
     *
     * @throws ExtractionFailedException if the document cannot be parsed or has no text
     */
    public String extractText(SourceDocument document) {
        if (document.content().length == 0) {
            throw new ExtractionFailedException("Document is empty");
        }

        String text;
        try (InputStream is = new ByteArrayInputStream(document.content())) {
            AutoDetectParser parser = new AutoDetectParser();
            BodyContentHandler handler = new BodyContentHandler(-1);
            Metadata metadata = new Metadata();
            metadata.set(TikaCoreProperties.RESOURCE_NAME_KEY, document.id());

            parser.parse(is, handler, metadata, new ParseContext());
            text = handler.toString();
        } catch (IOException | TikaException | SAXException e) {
            log.warn("Failed to parse document {}: {}", document.id(), e.getClass().getSimpleName());
            throw new ExtractionFailedException("Unable to read document text", e);
        }

        String normalized = normalize(text);
        if (normalized.isBlank()) {
            throw new ExtractionFailedException("Document contains no readable text");
        }
        log.debug("Extracted {} characters from {}", normalized.length(), document.id());
        return normalized;
    }

    /**
     * Collapse runs of spaces and blank lines left over by the parsers.
     */
    static String normalize(String text) {
        if (text == null) {
            return "";
        }
        return text.replace("\r\n", "\n")
                .replaceAll("[\\u200B-\\u200D\\uFEFF]", "")
                .replaceAll("[ \\t\\x0B\\f]+", " ")
                .replaceAll(" *\\n *", "\n")
                .replaceAll("\\n{3,}", "\n\n")
                .trim();
    }
}
