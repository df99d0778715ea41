package com.scholary.typesetter.api;

import com.scholary.typesetter.karaoke.WordTiming;
import java.util.List;

/**
 * Word timings aligned with the karaoke text.
 *
 * @param transcriptWords words read from the timing file
 * @param wordTimings one timing per word of the text, interpolated where the file had no match
 */
public record TimingResponse(int transcriptWords, List<WordTiming> wordTimings) {}
