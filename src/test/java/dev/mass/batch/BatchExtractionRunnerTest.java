package dev.mass.batch;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.DefaultApplicationArguments;

@ExtendWith(MockitoExtension.class)
class BatchExtractionRunnerTest {

  @Mock private BatchExtractionService service;

  private BatchExtractionRunner runner;

  @BeforeEach
  void setUp() {
    runner = new BatchExtractionRunner(service, new BatchProperties("outputs", "batch", 3, 0));
  }

  private static BatchReport emptyReport(String keyword, String domain) {
    CategoryResult none = new CategoryResult("links", 0, List.of());
    return BatchReport.of(keyword, domain, Instant.EPOCH, none, none, none);
  }

  @Test
  void passesPositionalArgumentsAndPages() {
    when(service.extractAll("cats", "example.com", 5)).thenReturn(emptyReport("cats", "example.com"));

    runner.run(new DefaultApplicationArguments("cats", "example.com", "--pages=5"));

    verify(service).extractAll("cats", "example.com", 5);
  }

  @Test
  void usesDefaultPagesWhenOptionAbsent() {
    when(service.extractAll("cats", "example.com", 3)).thenReturn(emptyReport("cats", "example.com"));

    runner.run(new DefaultApplicationArguments("cats", "example.com"));

    verify(service).extractAll("cats", "example.com", 3);
  }

  @Test
  void missingDomainIsRejected() {
    assertThatThrownBy(() -> runner.run(new DefaultApplicationArguments("cats")))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("Usage");
    verifyNoInteractions(service);
  }

  @Test
  void nonNumericPagesIsRejected() {
    assertThatThrownBy(
            () -> runner.run(new DefaultApplicationArguments("cats", "example.com", "--pages=many")))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("--pages");
  }
}
