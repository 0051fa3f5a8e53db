package dev.hiringvault;

import dev.hiringvault.config.ScreeningProperties;
import dev.hiringvault.document.DocumentLoader;
import dev.hiringvault.export.ShortlistExporter;
import dev.hiringvault.metrics.ScreeningMetrics;
import dev.hiringvault.model.BatchResult;
import dev.hiringvault.model.JobProfile;
import dev.hiringvault.model.PiiRecord;
import dev.hiringvault.model.ProfessionalProfile;
import dev.hiringvault.model.ShortlistEntry;
import dev.hiringvault.model.SourceDocument;
import dev.hiringvault.model.Token;
import dev.hiringvault.selection.AnonymousCandidate;
import dev.hiringvault.selection.SelectionRegistry;
import dev.hiringvault.service.ScreeningService;
import dev.hiringvault.service.ScreeningSession;
import dev.hiringvault.vault.PiiVault;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ScreeningRunnerTest {

  private static final JobProfile JOB = new JobProfile("Backend Engineer", List.of("Go", "SQL"), "", "");
  private static final SourceDocument JD = SourceDocument.ofText("jd.txt", "Backend Engineer");

  @Mock
  private ScreeningService screeningService;

  @Mock
  private DocumentLoader documentLoader;

  @Mock
  private ShortlistExporter shortlistExporter;

  @Mock
  private ScreeningSession session;

  private ScreeningProperties properties;
  private ScreeningRunner screeningRunner;

  private AnonymousCandidate jane;
  private AnonymousCandidate john;

  @BeforeEach
  void setUp() {
    properties = new ScreeningProperties();
    properties.setJobDescription("jd.txt");
    properties.setDocumentsDir("cvs");
    properties.setExportFile("shortlist.txt");
    screeningRunner = new ScreeningRunner(screeningService, documentLoader, shortlistExporter, properties);
  }

  private void stubSession() {
    PiiVault vault = new PiiVault();
    jane = candidate(vault.store(new PiiRecord("Jane Doe", "jane@example.com", "", "jane.pdf")), "Candidate A", 92, 0);
    john = candidate(vault.store(new PiiRecord("John Roe", "john@example.com", "", "john.pdf")), "Candidate B", 60, 1);
    SelectionRegistry registry = new SelectionRegistry(List.of(jane, john), vault,
        new ScreeningMetrics(new SimpleMeterRegistry()));

    when(documentLoader.load(Path.of("jd.txt"))).thenReturn(JD);
    when(screeningService.analyzeJobDescription(JD)).thenReturn(Mono.just(JOB));
    when(documentLoader.loadDirectory(Path.of("cvs"))).thenReturn(List.of());
    when(screeningService.openSession(List.of(), JOB)).thenReturn(Mono.just(session));
    when(session.getBatchResult()).thenReturn(new BatchResult(List.of(jane, john), List.of(), 2));
    when(session.getRegistry()).thenReturn(registry);
    when(shortlistExporter.export(any(), eq("Backend Engineer"), anyList())).thenReturn(Path.of("shortlist.txt"));
  }

  private AnonymousCandidate candidate(Token token, String alias, int score, int index) {
    return new AnonymousCandidate(token, alias,
        new ProfessionalProfile(Set.of("Go"), "Backend engineer", score, "rationale"), index);
  }

  @SuppressWarnings("unchecked")
  private List<ShortlistEntry> exportedEntries() {
    ArgumentCaptor<List<ShortlistEntry>> captor = ArgumentCaptor.forClass(List.class);
    verify(shortlistExporter).export(eq(Path.of("shortlist.txt")), eq("Backend Engineer"), captor.capture());
    return captor.getValue();
  }

  @Test
  void execute_selectTopAndReveal_exportsRevealedIdentity() {
    // Arrange
    properties.setSelectTop(1);
    properties.setReveal(List.of("candidate a"));
    stubSession();
    when(session.findByAlias("candidate a")).thenReturn(Optional.of(jane));

    // Act
    int result = screeningRunner.execute();

    // Assert
    assertEquals(1, result);
    assertEquals(List.of(new ShortlistEntry("Jane Doe (jane@example.com)", 92, true)), exportedEntries());
    verify(session).close();
  }

  @Test
  void execute_selectByAlias_keepsIdentityHidden() {
    // Arrange
    properties.setSelect(List.of("Candidate B", "Candidate Z"));
    stubSession();
    when(session.findByAlias("Candidate B")).thenReturn(Optional.of(john));
    when(session.findByAlias("Candidate Z")).thenReturn(Optional.empty());

    // Act
    int result = screeningRunner.execute();

    // Assert
    assertEquals(1, result);
    assertEquals(List.of(new ShortlistEntry("Candidate B", 60, false)), exportedEntries());
  }

  @Test
  void execute_noSelection_exportsEmptyShortlist() {
    // Arrange
    stubSession();

    // Act
    int result = screeningRunner.execute();

    // Assert
    assertEquals(0, result);
    assertEquals(List.of(), exportedEntries());
  }

  @Test
  void execute_missingInputs_throwsException() {
    // Arrange
    properties.setDocumentsDir("");

    // Act & Assert
    IllegalStateException e = assertThrows(IllegalStateException.class, () -> screeningRunner.execute());
    assertInstanceOf(IllegalStateException.class, e.getCause());
    verifyNoInteractions(screeningService);
  }

  @Test
  void execute_analysisFails_throwsException() {
    // Arrange
    when(documentLoader.load(Path.of("jd.txt"))).thenReturn(JD);
    when(screeningService.analyzeJobDescription(JD)).thenReturn(Mono.error(new RuntimeException("API error")));

    // Act & Assert
    assertThrows(IllegalStateException.class, () -> screeningRunner.execute());
    verify(screeningService, never()).openSession(any(), any());
  }
}
