package dev.hiringvault.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Tuning of the candidate pipeline.
 * Loaded from application.yml under 'screening.pipeline' prefix.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "screening.pipeline")
public class PipelineProperties {

    /**
     * Maximum number of documents processed at the same time.
     */
    private int concurrency = 4;

    /**
     * Upper bound for extraction plus scoring of a single document.
     */
    private Duration documentTimeout = Duration.ofSeconds(90);
}
