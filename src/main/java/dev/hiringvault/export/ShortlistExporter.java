package dev.hiringvault.export;

import dev.hiringvault.model.ShortlistEntry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.thymeleaf.TemplateEngine;
import org.thymeleaf.context.Context;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;

/**
 * Renders the reviewer's shortlist as a downloadable text file.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ShortlistExporter {

    private static final String TEMPLATE = "shortlist";

    private final TemplateEngine exportTemplateEngine;

    /**
     * Render the shortlist text.
     *
     * @param jobTitle Title of the job the shortlist is for
     * @param entries  Output of the selection registry export
     */
    public String render(String jobTitle, List<ShortlistEntry> entries) {
        Context context = new Context(Locale.getDefault());
        context.setVariable("jobTitle", jobTitle);
        context.setVariable("generatedOn", LocalDate.now().format(DateTimeFormatter.ISO_LOCAL_DATE));
        context.setVariable("entries", entries);
        return exportTemplateEngine.process(TEMPLATE, context);
    }

    /**
     * Render and write the shortlist to a file, replacing any previous export.
     *
     * @return the written file
     */
    public Path export(Path target, String jobTitle, List<ShortlistEntry> entries) {
        String content = render(jobTitle, entries);
        try {
            Path parent = target.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(target, content, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to write shortlist to " + target, e);
        }
        // Entries may hold revealed identities: log the count only
        log.info("Shortlist with {} entries written to {}", entries.size(), target);
        return target;
    }
}
