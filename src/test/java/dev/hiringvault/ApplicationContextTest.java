package dev.hiringvault;

import dev.hiringvault.ai.ExtractionAdapter;
import dev.hiringvault.ai.JobProfileAnalyzer;
import dev.hiringvault.ai.KeywordCandidateExtractor;
import dev.hiringvault.ai.KeywordFitScorer;
import dev.hiringvault.ai.KeywordJobProfileAnalyzer;
import dev.hiringvault.ai.ScoringAdapter;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.bean.override.mockito.MockitoBean;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
class ApplicationContextTest {

  @MockitoBean
  private ScreeningRunner screeningRunner;

  @MockitoBean
  private ExitManager exitManager;

  @Autowired
  private ExtractionAdapter extractionAdapter;

  @Autowired
  private ScoringAdapter scoringAdapter;

  @Autowired
  private JobProfileAnalyzer jobProfileAnalyzer;

  @Test
  void contextLoads_withLocalAdapters() {
    assertThat(extractionAdapter).isInstanceOf(KeywordCandidateExtractor.class);
    assertThat(scoringAdapter).isInstanceOf(KeywordFitScorer.class);
    assertThat(jobProfileAnalyzer).isInstanceOf(KeywordJobProfileAnalyzer.class);
  }
}
