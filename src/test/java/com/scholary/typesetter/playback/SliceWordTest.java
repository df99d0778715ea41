package com.scholary.typesetter.playback;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import org.junit.jupiter.api.Test;

class SliceWordTest {

  private final SliceWord word = new SliceWord(0, 0, 3, 1.0, 2.0);

  @Test
  void phaseAt_followsPlayhead() {
    assertThat(word.phaseAt(0.5)).isEqualTo(WordPhase.PENDING);
    assertThat(word.phaseAt(1.0)).isEqualTo(WordPhase.ACTIVE);
    assertThat(word.phaseAt(2.0)).isEqualTo(WordPhase.COMPLETE);
  }

  @Test
  void fillAt_clampedToUnitRange() {
    assertThat(word.fillAt(0)).isZero();
    assertThat(word.fillAt(1.5)).isCloseTo(0.5, within(1e-9));
    assertThat(word.fillAt(3)).isEqualTo(1.0);
  }

  @Test
  void fillAt_zeroLengthWordCompletesImmediately() {
    SliceWord instant = new SliceWord(0, 0, 3, 1.0, 1.0);

    assertThat(instant.fillAt(1.0)).isZero();
    assertThat(instant.fillAt(1.01)).isEqualTo(1.0);
  }
}
