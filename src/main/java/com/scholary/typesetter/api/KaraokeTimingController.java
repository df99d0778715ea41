package com.scholary.typesetter.api;

import com.scholary.typesetter.karaoke.WordTiming;
import com.scholary.typesetter.karaoke.timing.TimingAligner;
import com.scholary.typesetter.karaoke.timing.TimingFileParser;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/** REST API for importing karaoke timing files. */
@RestController
@Tag(name = "Karaoke", description = "Karaoke timing ingestion")
public class KaraokeTimingController {

  private static final Logger LOGGER = LoggerFactory.getLogger(KaraokeTimingController.class);

  private final TimingFileParser parser;
  private final TimingAligner aligner;

  public KaraokeTimingController(TimingFileParser parser, TimingAligner aligner) {
    this.parser = parser;
    this.aligner = aligner;
  }

  @PostMapping("/api/karaoke/timings")
  @Operation(
      summary = "Align a timing file",
      description = "Parse a timing file and align its words with the karaoke text")
  public ResponseEntity<TimingResponse> alignTimings(@Valid @RequestBody TimingRequest request) {
    List<WordTiming> transcript = parser.parse(request.content(), request.format());
    List<WordTiming> aligned = aligner.align(request.text(), transcript);
    LOGGER.info("Aligned timing file: transcript={}, words={}", transcript.size(), aligned.size());
    return ResponseEntity.ok(new TimingResponse(transcript.size(), aligned));
  }
}
