package dev.hiringvault.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

/**
 * Inputs and reviewer decisions for a screening run.
 * Loaded from application.yml under 'screening' prefix.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "screening")
public class ScreeningProperties {

    private String jobDescription;
    private String documentsDir;

    // Reviewer decisions, by alias
    private List<String> select = new ArrayList<>();
    private int selectTop = 0;
    private List<String> reveal = new ArrayList<>();

    private String exportFile = "shortlist.txt";
}
