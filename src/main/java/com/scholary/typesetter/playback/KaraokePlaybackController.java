package com.scholary.typesetter.playback;

import com.scholary.typesetter.karaoke.KaraokeSlice;
import com.scholary.typesetter.karaoke.KaraokeSource;
import com.scholary.typesetter.karaoke.LetterTiming;
import com.scholary.typesetter.karaoke.WordCharRange;
import com.scholary.typesetter.logging.StructuredLogger;
import com.scholary.typesetter.playback.BoundedRetry.Outcome;
import com.scholary.typesetter.playback.FrameScheduler.FrameLoop;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drives word highlighting of one karaoke source in step with its audio.
 *
 * <p>One slice plays at a time. A frame loop reads the audio time and updates the phase and fill
 * of every word in the slice. When the playhead passes the last word of a slice that is not the
 * source's last, audio pauses and the controller records where the next page resumes.
 *
 * <p>All methods are synchronized: frames run on the scheduler thread while requests arrive from
 * callers.
 */
public class KaraokePlaybackController {

  private static final Logger LOGGER = LoggerFactory.getLogger(KaraokePlaybackController.class);

  /** Gap after the last word when the source has no further timed word. */
  static final double TRAILING_RESUME_OFFSET = 0.01;

  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);
  private final KaraokeSource source;
  private final AudioHandle audio;
  private final FrameScheduler frames;
  private final int maxInitAttempts;
  private final Map<KaraokeSlice, SliceView> views = new LinkedHashMap<>();

  private SliceView currentView;
  private List<SliceWord> currentWords = List.of();
  private Integer sliceResumeWordIndex;
  private Integer resumeWordIndex;
  private Double resumeTime;
  private boolean waitingForNextPage;
  private double highlightStartTime;
  private FrameLoop loop;
  private BoundedRetry markupRetry;
  private KaraokeSliceInitializationException lastFailure;
  private boolean disposed;

  public KaraokePlaybackController(
      KaraokeSource source,
      AudioHandle audio,
      FrameScheduler frames,
      int maxInitAttempts) {
    this.source = source;
    this.audio = audio;
    this.frames = frames;
    this.maxInitAttempts = maxInitAttempts;
    audio.onEnded(this::handleEnded);
  }

  public KaraokeSource source() {
    return source;
  }

  /**
   * Start playing a slice.
   *
   * <p>A fresh request clears all highlighting and resume state and starts the audio from 0. A
   * resume request seeks to the resume time and keeps the waiting flag until the playhead reaches
   * the resume word.
   *
   * @return false when the slice markup could not be prepared, in which case nothing plays
   */
  public synchronized boolean playSlice(SliceView view, PlayRequest request) {
    if (disposed) {
      throw new IllegalStateException("Controller for " + source.id() + " is disposed");
    }
    KaraokeSlice slice = view.slice();
    if (!source.id().equals(slice.karaokeId())) {
      throw new IllegalArgumentException(
          "Slice of " + slice.karaokeId() + " cannot play on controller " + source.id());
    }
    views.put(slice, view);
    List<SliceWord> words = SliceMarkupBuilder.words(source, slice);
    if (!installMarkup(view, words)) {
      view.setPlaying(false);
      LOGGER.warn(
          "Karaoke slice markup not ready: id={}, range=[{}-{})",
          source.id(),
          slice.startChar(),
          slice.endChar());
      return false;
    }

    audio.pause();
    cancelLoop();
    if (!request.isResuming()) {
      resetHighlighting();
      clearResumeState();
    }
    highlightStartTime = startTimeFor(slice, request);
    currentView = view;
    currentWords = words;
    sliceResumeWordIndex = request.resumeWordIndex();
    markupRetry = new BoundedRetry(maxInitAttempts);
    lastFailure = null;

    audio.seek(request.isResuming() ? highlightStartTime : 0);
    view.setPlaying(true);
    audio.play();
    if (currentView != null) {
      loop = frames.start(this::step);
    }
    LOGGER.debug(
        "Playing karaoke slice: id={}, range=[{}-{}), highlightStart={}s, resuming={}",
        source.id(),
        slice.startChar(),
        slice.endChar(),
        highlightStartTime,
        request.isResuming());
    return true;
  }

  /** Advance highlighting by one frame. */
  public synchronized void step() {
    SliceView view = currentView;
    if (view == null || loop == null) {
      return;
    }
    if (!view.isConnected()) {
      LOGGER.debug("Karaoke slice markup detached, stopping frames: id={}", source.id());
      cancelLoop();
      return;
    }
    if (!view.hasWordMarkup()) {
      Outcome outcome = markupRetry.attempt(() -> installMarkup(view, currentWords));
      if (outcome == Outcome.RETRY) {
        return;
      }
      if (outcome == Outcome.EXHAUSTED) {
        failInitialization(view);
        return;
      }
    }

    double time = audio.currentTime();
    if (currentView == null) {
      // playback ended while reading the time
      return;
    }
    renderWords(view, time);
    releaseResumePointIfPassed(time);
    pauseAtBoundaryIfReached(view, time);
  }

  /** Pause audio and frames, keeping the slice and resume state. */
  public synchronized void pause() {
    audio.pause();
    cancelLoop();
    if (currentView != null) {
      currentView.setPlaying(false);
    }
  }

  /** Stop frames when the page showing the slice is left. Resume state is kept. */
  public synchronized void suspend() {
    if (loop != null) {
      LOGGER.debug("Karaoke frames suspended on page leave: id={}", source.id());
    }
    pause();
  }

  /** Stop playback, rewind to 0 and clear highlighting and resume state. */
  public synchronized void stop() {
    audio.pause();
    audio.seek(0);
    cancelLoop();
    resetHighlighting();
    clearResumeState();
    currentView = null;
    currentWords = List.of();
    sliceResumeWordIndex = null;
  }

  /** Release the audio handle. The controller cannot play afterwards. */
  public synchronized void dispose() {
    if (disposed) {
      return;
    }
    cancelLoop();
    audio.release();
    views.values().forEach(view -> view.setPlaying(false));
    views.clear();
    currentView = null;
    disposed = true;
    LOGGER.debug("Karaoke controller disposed: id={}", source.id());
  }

  public synchronized PlaybackState state() {
    return new PlaybackState(
        currentView == null ? null : currentView.slice(),
        resumeWordIndex,
        resumeTime,
        waitingForNextPage,
        audio.isPlaying());
  }

  /** Time the highlighting of the last played slice started from. */
  public synchronized double highlightStartTime() {
    return highlightStartTime;
  }

  /** Failure of the last markup retry, if it ran out of attempts. */
  public synchronized Optional<KaraokeSliceInitializationException> lastFailure() {
    return Optional.ofNullable(lastFailure);
  }

  public synchronized boolean isDisposed() {
    return disposed;
  }

  public synchronized boolean isLooping() {
    return loop != null;
  }

  private synchronized void handleEnded() {
    cancelLoop();
    resetHighlighting();
    views.values().forEach(view -> view.setPlaying(false));
    clearResumeState();
    currentView = null;
    currentWords = List.of();
    sliceResumeWordIndex = null;
    LOGGER.debug("Karaoke playback ended: id={}", source.id());
  }

  private boolean installMarkup(SliceView view, List<SliceWord> words) {
    if (view.hasWordMarkup()) {
      return true;
    }
    return view.installWordMarkup(SliceMarkupBuilder.markup(source, view.slice(), words), words);
  }

  private double startTimeFor(KaraokeSlice slice, PlayRequest request) {
    if (request.resumeTime() != null) {
      return request.resumeTime();
    }
    if (request.resumeWordIndex() != null) {
      Optional<WordCharRange> word = source.word(request.resumeWordIndex());
      if (word.isPresent()) {
        return word.get().start();
      }
    }
    return source.letterTiming(slice.startChar()).map(LetterTiming::start).orElse(0.0);
  }

  private void renderWords(SliceView view, double time) {
    for (SliceWord word : currentWords) {
      if (sliceResumeWordIndex != null && word.wordIndex() < sliceResumeWordIndex) {
        view.showWord(word.wordIndex(), WordPhase.COMPLETE, 1.0);
        continue;
      }
      WordPhase phase = word.phaseAt(time);
      double fill =
          switch (phase) {
            case COMPLETE -> 1.0;
            case ACTIVE -> word.fillAt(time);
            case PENDING -> 0.0;
          };
      view.showWord(word.wordIndex(), phase, fill);
    }
  }

  /** The waiting flag clears only once the playhead reaches the resume word. */
  private void releaseResumePointIfPassed(double time) {
    if (!waitingForNextPage || sliceResumeWordIndex == null) {
      return;
    }
    Optional<WordCharRange> resumeWord = source.word(sliceResumeWordIndex);
    if (resumeWord.isPresent() && time >= resumeWord.get().start()) {
      waitingForNextPage = false;
      clearResumeState();
    }
  }

  private void pauseAtBoundaryIfReached(SliceView view, double time) {
    KaraokeSlice slice = view.slice();
    if (slice.endChar() >= source.length() || waitingForNextPage || currentWords.isEmpty()) {
      return;
    }
    SliceWord lastWord = currentWords.get(currentWords.size() - 1);
    if (time < lastWord.end()) {
      return;
    }
    Optional<WordCharRange> next =
        source.wordCharRanges().stream()
            .filter(word -> word.wordIndex() > lastWord.wordIndex())
            .findFirst();
    if (next.isPresent()) {
      resumeWordIndex = next.get().wordIndex();
      resumeTime = next.get().start();
    } else {
      resumeWordIndex = lastWord.wordIndex();
      resumeTime = lastWord.end() + TRAILING_RESUME_OFFSET;
    }
    waitingForNextPage = true;
    audio.pause();
    cancelLoop();
    view.setPlaying(false);
    structuredLogger.logPlaybackPausedAtBoundary(
        source.id(), slice.endChar(), time, resumeWordIndex);
  }

  private void failInitialization(SliceView view) {
    KaraokeSlice slice = view.slice();
    lastFailure =
        new KaraokeSliceInitializationException(
            String.format(
                "Word markup for slice [%d, %d) of %s not installed after %d attempts",
                slice.startChar(), slice.endChar(), source.id(), markupRetry.attempts()));
    LOGGER.error("Karaoke slice initialization failed: {}", lastFailure.getMessage());
    audio.pause();
    cancelLoop();
    view.setPlaying(false);
  }

  private void resetHighlighting() {
    views.values().forEach(SliceView::resetWords);
  }

  private void clearResumeState() {
    resumeWordIndex = null;
    resumeTime = null;
    waitingForNextPage = false;
  }

  private void cancelLoop() {
    if (loop != null) {
      loop.cancel();
      loop = null;
    }
  }
}
