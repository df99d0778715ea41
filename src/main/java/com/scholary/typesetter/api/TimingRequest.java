package com.scholary.typesetter.api;

import com.scholary.typesetter.karaoke.timing.TimingFormat;
import jakarta.validation.constraints.NotBlank;

/**
 * A timing file to align with karaoke text.
 *
 * @param text karaoke block text
 * @param format declared format, detected from the content when null
 * @param content timing file content
 */
public record TimingRequest(@NotBlank String text, TimingFormat format, @NotBlank String content) {}
