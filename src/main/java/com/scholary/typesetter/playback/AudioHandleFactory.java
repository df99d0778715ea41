package com.scholary.typesetter.playback;

import com.scholary.typesetter.karaoke.KaraokeSource;

/** Opens the audio track of a karaoke source. */
@FunctionalInterface
public interface AudioHandleFactory {

  AudioHandle open(KaraokeSource source);
}
