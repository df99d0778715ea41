package com.scholary.typesetter.content;

import java.util.List;

/**
 * Block content ready for element parsing.
 *
 * @param block the source block
 * @param html content with videos removed and long dashes replaced
 * @param blankPageVideos videos that become dedicated pages, in source order
 */
public record PreparedBlock(ContentBlock block, String html, List<VideoEmbed> blankPageVideos) {

  public PreparedBlock {
    blankPageVideos = List.copyOf(blankPageVideos);
  }
}
