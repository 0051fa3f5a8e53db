package dev.hiringvault.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

/**
 * Settings of the keyword based adapters used when no AI provider is configured.
 * Loaded from application.yml under 'screening.local' prefix.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "screening.local")
public class LocalAnalysisProperties {

    private List<String> skillVocabulary = new ArrayList<>();
    private int summaryLength = 400;
}
