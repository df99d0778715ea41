package com.scholary.typesetter.karaoke;

/** Time span during which a single character is sung. */
public record LetterTiming(double start, double end) {}
