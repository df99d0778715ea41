package com.scholary.typesetter.integration;

import static org.assertj.core.api.Assertions.assertThat;

import com.scholary.typesetter.api.PaginateRequest;
import com.scholary.typesetter.api.PaginationResponse;
import com.scholary.typesetter.content.ChapterRecord;
import com.scholary.typesetter.measure.PageMode;
import com.scholary.typesetter.pagination.Page;
import com.scholary.typesetter.service.ReadingPosition;
import java.time.Duration;
import java.util.Collections;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

/**
 * End-to-end test of the pagination API.
 *
 * <p>Runs the whole application with the fixed-advance text meter, paginates a small book over
 * HTTP and reads the run back once the background hyphenation pass has stored its pages.
 */
@SpringBootTest(
    webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT,
    properties = "typesetter.typography.textMeter=FIXED")
class PaginationIntegrationTest {

  @Autowired private TestRestTemplate restTemplate;

  @Test
  void paginateBook_thenFetchHyphenatedRun() throws Exception {
    String longText = String.join(" ", Collections.nCopies(600, "pagination"));
    List<ChapterRecord> chapters =
        List.of(
            new ChapterRecord(
                "c1",
                "Chapter one",
                "<p>" + longText + "</p><p>End^[A note]</p>",
                null,
                null,
                1,
                false,
                false,
                List.of()),
            new ChapterRecord(
                "cover", "Cover", "", null, "cover.jpg", null, true, false, List.of()));

    ResponseEntity<PaginationResponse> response =
        restTemplate.postForEntity(
            "/api/pagination",
            new PaginateRequest(
                chapters, PageMode.DOCUMENT, null, null, new ReadingPosition("c1", 1)),
            PaginationResponse.class);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
    PaginationResponse body = response.getBody();
    assertThat(body).isNotNull();
    assertThat(body.pages()).hasSizeGreaterThan(2);
    assertThat(body.pages().get(0).cover()).isTrue();
    assertThat(body.pages().get(1).chapterId()).isEqualTo("c1");
    assertThat(body.initialPosition().flatIndex()).isEqualTo(2);
    Page last = body.pages().get(body.pages().size() - 1);
    assertThat(last.footnotes()).hasSize(1);
    assertThat(last.totalPages()).isEqualTo(body.pages().size() - 1);

    PaginationResponse stored = awaitHyphenated(body.runId());
    assertThat(stored.pages().get(1).content()).contains("pag\u00ADi\u00ADna\u00ADtion");
  }

  @Test
  void getRun_unknownRunIsNotFound() {
    ResponseEntity<String> response =
        restTemplate.getForEntity("/api/pagination/unknown", String.class);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
  }

  private PaginationResponse awaitHyphenated(String runId) throws InterruptedException {
    long deadline = System.nanoTime() + Duration.ofSeconds(10).toNanos();
    PaginationResponse latest = null;
    while (System.nanoTime() < deadline) {
      latest = restTemplate.getForObject("/api/pagination/" + runId, PaginationResponse.class);
      if (latest != null && latest.hyphenated()) {
        return latest;
      }
      Thread.sleep(100);
    }
    throw new AssertionError("Run " + runId + " was not hyphenated in time: " + latest);
  }
}
