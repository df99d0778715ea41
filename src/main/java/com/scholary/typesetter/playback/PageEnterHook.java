package com.scholary.typesetter.playback;

import com.scholary.typesetter.karaoke.KaraokeSlice;
import com.scholary.typesetter.karaoke.WordCharRange;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** Continues karaoke playback that paused at a page boundary once the next page is shown. */
@Component
public class PageEnterHook {

  private static final Logger LOGGER = LoggerFactory.getLogger(PageEnterHook.class);

  private final KaraokeControllerRegistry registry;

  public PageEnterHook(KaraokeControllerRegistry registry) {
    this.registry = registry;
  }

  /**
   * Resume every source waiting for the page that was just entered.
   *
   * <p>Playback resumes in the slice holding the resume word, or in the first slice of the source
   * on this page when none holds it.
   *
   * @param sliceViews slice views shown on the entered page
   * @return the slices playback resumed in
   */
  public List<KaraokeSlice> onPageEnter(List<SliceView> sliceViews) {
    Map<String, List<SliceView>> bySource = new LinkedHashMap<>();
    sliceViews.forEach(
        view ->
            bySource.computeIfAbsent(view.slice().karaokeId(), id -> new ArrayList<>()).add(view));

    List<KaraokeSlice> resumed = new ArrayList<>();
    bySource.forEach(
        (karaokeId, views) ->
            registry
                .existing(karaokeId)
                .flatMap(controller -> resume(controller, views))
                .ifPresent(
                    slice -> {
                      registry.pauseAllExcept(karaokeId);
                      resumed.add(slice);
                    }));
    return resumed;
  }

  /** Stop frame loops of every source when the page is left. */
  public void onPageLeave() {
    registry.suspendAll();
  }

  private Optional<KaraokeSlice> resume(
      KaraokePlaybackController controller, List<SliceView> views) {
    PlaybackState state = controller.state();
    if (!state.waitingForNextPage() || !state.hasResumePoint()) {
      return Optional.empty();
    }
    int resumeChar =
        controller
            .source()
            .word(state.resumeWordIndex())
            .map(WordCharRange::charStart)
            .orElse(-1);
    SliceView target =
        views.stream()
            .filter(view -> view.slice().contains(resumeChar))
            .findFirst()
            .orElse(views.get(0));
    LOGGER.debug(
        "Resuming karaoke on page enter: id={}, word={}, time={}s",
        target.slice().karaokeId(),
        state.resumeWordIndex(),
        state.resumeTime());
    boolean playing =
        controller.playSlice(
            target, PlayRequest.resume(state.resumeWordIndex(), state.resumeTime()));
    return playing ? Optional.of(target.slice()) : Optional.empty();
  }
}
