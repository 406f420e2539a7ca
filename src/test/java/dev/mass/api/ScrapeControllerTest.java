package dev.mass.api;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import dev.mass.pipeline.ScrapeResponse;
import dev.mass.pipeline.ScrapeService;
import dev.mass.scrape.ResultItem;
import dev.mass.scrape.RunMetadata;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(controllers = ScrapeController.class)
class ScrapeControllerTest {

  private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

  @Autowired MockMvc mvc;

  @MockitoBean ScrapeService scrapeService;

  @MockitoBean Clock clock;

  @Test
  void scrapeReturnsResultsAndSnakeCaseMetadata() throws Exception {
    var metadata = new RunMetadata("cats", null, NOW, 1, List.of("google"), 1.25);
    when(scrapeService.scrape("cats", "example.com", 2))
        .thenReturn(
            new ScrapeResponse(
                List.of(ResultItem.of("Cats", "https://example.com/cats", "google")), metadata));

    mvc.perform(
            post("/api/scrape")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"keywords\":\"cats\",\"target_domain\":\"example.com\",\"max_pages\":2}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.results[0].link").value("https://example.com/cats"))
        .andExpect(jsonPath("$.results[0].source").value("google"))
        .andExpect(jsonPath("$.metadata.total_results").value(1))
        .andExpect(jsonPath("$.metadata.sources_used[0]").value("google"))
        .andExpect(jsonPath("$.metadata.execution_time").value(1.25));
  }

  @Test
  void optionalFieldsMayBeOmitted() throws Exception {
    when(scrapeService.scrape(any(), isNull(), isNull()))
        .thenReturn(
            new ScrapeResponse(List.of(), new RunMetadata("cats", null, NOW, 0, List.of(), 0.0)));

    mvc.perform(post("/api/scrape").contentType(MediaType.APPLICATION_JSON).content("{\"keywords\":\"cats\"}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.results").isEmpty());
    verify(scrapeService).scrape("cats", null, null);
  }

  @Test
  void blankKeywordsAreRejected() throws Exception {
    mvc.perform(post("/api/scrape").contentType(MediaType.APPLICATION_JSON).content("{\"keywords\":\" \"}"))
        .andExpect(status().isBadRequest());
    verifyNoInteractions(scrapeService);
  }

  @Test
  void nonPositivePageCountIsRejected() throws Exception {
    mvc.perform(
            post("/api/scrape")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"keywords\":\"cats\",\"maxPages\":0}"))
        .andExpect(status().isBadRequest());
  }

  @Test
  void illegalArgumentBecomesBadRequestProblem() throws Exception {
    when(scrapeService.scrape(any(), any(), any()))
        .thenThrow(new IllegalArgumentException("maxPages must be >= 1"));

    mvc.perform(post("/api/scrape").contentType(MediaType.APPLICATION_JSON).content("{\"keywords\":\"cats\"}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.detail").value("maxPages must be >= 1"));
  }

  @Test
  void unexpectedFailureBecomesServerErrorProblem() throws Exception {
    when(scrapeService.scrape(any(), any(), any())).thenThrow(new IllegalStateException("executor down"));

    mvc.perform(post("/api/scrape").contentType(MediaType.APPLICATION_JSON).content("{\"keywords\":\"cats\"}"))
        .andExpect(status().isInternalServerError())
        .andExpect(jsonPath("$.status").value(500))
        .andExpect(jsonPath("$.detail").value("executor down"));
  }

  @Test
  void healthReportsStatusAndTimestamp() throws Exception {
    when(clock.instant()).thenReturn(NOW);

    mvc.perform(get("/api/health"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("healthy"))
        .andExpect(jsonPath("$.timestamp").value("2026-03-01T10:00:00Z"));
  }
}
