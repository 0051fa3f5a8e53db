package dev.hiringvault;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Terminates the JVM with the screening exit code.
 * Suppressed under a test runner so tests can assert on the status instead.
 */
@Slf4j
@Component
public class ExitManager {

  private static final List<String> TEST_RUNNER_MARKERS = List.of("junit", "surefire", "intellij");

  public void exit(int status) {
    if (isTest()) {
      log.debug("Exit with status {} suppressed under test runner", status);
      return;
    }
    System.exit(status);
  }

  protected boolean isTest() {
    String cp = System.getProperty("java.class.path", "");
    return TEST_RUNNER_MARKERS.stream().anyMatch(cp::contains);
  }
}
