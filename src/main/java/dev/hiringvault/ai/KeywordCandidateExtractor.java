package dev.hiringvault.ai;

import dev.hiringvault.config.LocalAnalysisProperties;
import dev.hiringvault.document.DocumentTextExtractor;
import dev.hiringvault.exception.ExtractionFailedException;
import dev.hiringvault.model.CandidateExtraction;
import dev.hiringvault.model.PiiRecord;
import dev.hiringvault.model.ProfessionalAttributes;
import dev.hiringvault.model.SourceDocument;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.Arrays;
import java.util.Optional;
import java.util.regex.Matcher;

/**
 * Offline extraction: regular expressions for contact data, a configured skill vocabulary
 * for the professional attributes. Used when no AI provider is configured.
 */
@Slf4j
@Service
@RequiredArgsConstructor
@ConditionalOnProperty(name = "app.ai.provider", havingValue = "local", matchIfMissing = true)
public class KeywordCandidateExtractor implements ExtractionAdapter {

    private static final int MAX_NAME_LENGTH = 60;

    private final DocumentTextExtractor textExtractor;
    private final LocalAnalysisProperties properties;

    @Override
    public Mono<CandidateExtraction> extract(SourceDocument document) {
        return Mono.fromCallable(() -> extractText(document.id(), textExtractor.extractText(document)))
                .subscribeOn(Schedulers.boundedElastic());
    }

    CandidateExtraction extractText(String documentId, String text) {
        String name = findName(text)
                .orElseThrow(() -> new ExtractionFailedException("No candidate name found"));
        PiiRecord pii = new PiiRecord(name, findEmail(text), PiiScrubber.findPhone(text), documentId);

        String body = PiiScrubber.scrub(text.substring(text.indexOf(name) + name.length()), pii);
        String summary = truncate(body.replaceAll("\\s+", " "));

        ProfessionalAttributes attributes = new ProfessionalAttributes(
                KeywordMatcher.findTerms(body, properties.getSkillVocabulary()), summary);
        log.debug("Extracted {} skills from {}", attributes.skills().size(), documentId);
        return new CandidateExtraction(pii, attributes);
    }

    /**
     * The first short line without contact data or digits is taken as the name.
     */
    private Optional<String> findName(String text) {
        return Arrays.stream(text.split("\\n"))
                .map(String::trim)
                .filter(line -> !line.isEmpty() && line.length() <= MAX_NAME_LENGTH)
                .filter(line -> !PiiScrubber.EMAIL.matcher(line).find())
                .filter(line -> line.chars().noneMatch(Character::isDigit))
                .findFirst();
    }

    private static String findEmail(String text) {
        Matcher matcher = PiiScrubber.EMAIL.matcher(text);
        return matcher.find() ? matcher.group().trim() : "";
    }

    private String truncate(String summary) {
        int max = Math.max(0, properties.getSummaryLength());
        return summary.length() > max ? summary.substring(0, max).trim() + "..." : summary.trim();
    }
}
