package com.scholary.typesetter.api;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.scholary.typesetter.measure.PageMode;
import com.scholary.typesetter.pagination.Page;
import com.scholary.typesetter.run.PaginationRun;
import com.scholary.typesetter.service.PaginationRequest;
import com.scholary.typesetter.service.PaginationResult;
import com.scholary.typesetter.service.PaginationService;
import com.scholary.typesetter.service.PaginationSupersededException;
import com.scholary.typesetter.service.ResolvedPosition;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(PaginationController.class)
class PaginationControllerTest {

  private static final String BOOK =
      "{\"chapters\":[{\"id\":\"c1\",\"title\":\"One\",\"contentHtml\":\"<p>Hello</p>\","
          + "\"order\":1}],\"mode\":\"DOCUMENT\"}";

  @Autowired private MockMvc mockMvc;

  @MockBean private PaginationService paginationService;

  @Test
  void paginate_returnsPages() throws Exception {
    when(paginationService.paginate(any(PaginationRequest.class))).thenReturn(run());

    mockMvc
        .perform(post("/api/pagination").contentType(MediaType.APPLICATION_JSON).content(BOOK))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.runId").value("run-1"))
        .andExpect(jsonPath("$.hyphenated").value(false))
        .andExpect(jsonPath("$.pages[0].chapterId").value("c1"))
        .andExpect(jsonPath("$.pages[0].isCover").value(false))
        .andExpect(jsonPath("$.initialPosition.flatIndex").value(0));
  }

  @Test
  void paginate_rejectsEmptyBook() throws Exception {
    mockMvc
        .perform(
            post("/api/pagination")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"chapters\":[]}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.status").value(400))
        .andExpect(jsonPath("$.path").value("/api/pagination"));
  }

  @Test
  void paginate_rejectsMalformedJson() throws Exception {
    mockMvc
        .perform(post("/api/pagination").contentType(MediaType.APPLICATION_JSON).content("{"))
        .andExpect(status().isBadRequest());
  }

  @Test
  void paginate_conflictWhenSuperseded() throws Exception {
    when(paginationService.paginate(any(PaginationRequest.class)))
        .thenThrow(new PaginationSupersededException("Pagination superseded by a newer run"));

    mockMvc
        .perform(post("/api/pagination").contentType(MediaType.APPLICATION_JSON).content(BOOK))
        .andExpect(status().isConflict())
        .andExpect(jsonPath("$.message").value("Pagination superseded by a newer run"));
  }

  @Test
  void getRun_returnsStoredRun() throws Exception {
    when(paginationService.findRun("run-1")).thenReturn(Optional.of(run()));

    mockMvc
        .perform(get("/api/pagination/run-1"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.pages[0].content").value("<p>Hello</p>"));
  }

  @Test
  void getRun_notFound() throws Exception {
    when(paginationService.findRun("missing")).thenReturn(Optional.empty());

    mockMvc.perform(get("/api/pagination/missing")).andExpect(status().isNotFound());
  }

  private static PaginationRun run() {
    Page page =
        Page.builder().chapterIndex(1).chapterId("c1").pageIndex(0).content("<p>Hello</p>").build();
    return new PaginationRun(
        "run-1",
        1,
        PageMode.DOCUMENT,
        new PaginationResult(List.of(page), Map.of(), Map.of()),
        ResolvedPosition.START,
        false,
        Instant.now());
  }
}
