package com.scholary.typesetter.content;

/** A video that gets a page of its own. */
public record VideoEmbed(String src, String html) {}
