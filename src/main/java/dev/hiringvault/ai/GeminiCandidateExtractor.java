package dev.hiringvault.ai;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import dev.hiringvault.document.DocumentTextExtractor;
import dev.hiringvault.exception.ExtractionFailedException;
import dev.hiringvault.exception.ScreeningException;
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

import java.util.List;

/**
 * Extraction through Gemini: the CV text goes in, identity and professional fields come back
 * as separate JSON fields and are split into {@link PiiRecord} and {@link ProfessionalAttributes}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
@ConditionalOnProperty(name = "app.ai.provider", havingValue = "gemini")
public class GeminiCandidateExtractor implements ExtractionAdapter {

    private static final int MAX_TEXT_LENGTH = 12000;

    private final GeminiClient geminiClient;
    private final DocumentTextExtractor textExtractor;

    @Override
    public Mono<CandidateExtraction> extract(SourceDocument document) {
        return Mono.fromCallable(() -> textExtractor.extractText(document))
                .subscribeOn(Schedulers.boundedElastic())
                .flatMap(text -> geminiClient.generateJson(buildPrompt(text), CvAnalysis.class))
                .map(analysis -> toExtraction(document.id(), analysis))
                .onErrorMap(e -> !(e instanceof ScreeningException),
                        e -> new ExtractionFailedException("CV analysis failed: " + GeminiClient.describe(e), e));
    }

    CandidateExtraction toExtraction(String documentId, CvAnalysis analysis) {
        if (analysis.realName() == null || analysis.realName().isBlank()) {
            throw new ExtractionFailedException("CV analysis returned no candidate name");
        }
        PiiRecord pii = new PiiRecord(analysis.realName().trim(), nullToEmpty(analysis.email()),
                nullToEmpty(analysis.phone()), documentId);

        // The model is asked to keep identity out of the summary; scrub anyway
        String summary = PiiScrubber.scrub(analysis.summary(), pii);
        List<String> skills = analysis.skills() != null ? analysis.skills() : List.of();

        log.debug("CV {} analysed: {} skills", documentId, skills.size());
        return new CandidateExtraction(pii, ProfessionalAttributes.of(skills, summary));
    }

    private static String nullToEmpty(String value) {
        return value != null ? value.trim() : "";
    }

    private String buildPrompt(String text) {
        String cv = text.length() > MAX_TEXT_LENGTH ? text.substring(0, MAX_TEXT_LENGTH) + "..." : text;
        return String.format("""
                Extract information from the following Resume/CV and return it as a JSON object with this exact structure:
                {
                    "realName": "Full Name",
                    "email": "Email address",
                    "phone": "Phone number",
                    "skills": ["Skill 1", "Skill 2", ...],
                    "summary": "Brief professional summary extracted from the CV"
                }
                The summary must not mention the candidate's name, email, phone or address.
                Return ONLY the valid JSON object.

                CV Content:
                %s
                """, cv);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record CvAnalysis(String realName, String email, String phone, List<String> skills, String summary) {
    }
}
