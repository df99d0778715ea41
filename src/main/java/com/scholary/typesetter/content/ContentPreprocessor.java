package com.scholary.typesetter.content;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Prepares block HTML before elements are measured.
 *
 * <ul>
 *   <li>Blank-page videos (the default mode) are removed from the flow and returned separately
 *   <li>Background videos are removed from the flow; they are matched to pages by target number
 *   <li>Em and en dashes become plain hyphens
 * </ul>
 */
@Component
public class ContentPreprocessor {

  private static final Logger LOGGER = LoggerFactory.getLogger(ContentPreprocessor.class);

  static final String MODE_ATTRIBUTE = "data-video-mode";
  static final String TARGET_PAGE_ATTRIBUTE = "data-target-page";
  static final String MODE_BACKGROUND = "background";
  static final String MODE_BLANK_PAGE = "blank-page";

  public PreparedBlock prepare(ContentBlock block) {
    Element body = HtmlFragments.parseBody(block.html());
    List<VideoEmbed> blankPageVideos = new ArrayList<>();

    for (Element video : body.select("video")) {
      String src = videoSource(video);
      if (src.isEmpty()) {
        continue;
      }
      String mode = video.attr(MODE_ATTRIBUTE);
      if (mode.isEmpty() || MODE_BLANK_PAGE.equals(mode)) {
        blankPageVideos.add(new VideoEmbed(src, video.outerHtml()));
        video.remove();
      } else if (MODE_BACKGROUND.equals(mode)) {
        video.remove();
      }
    }

    String html = replaceLongDashes(body.html());
    return new PreparedBlock(block, html, blankPageVideos);
  }

  /**
   * Collect background videos declared anywhere in a chapter's blocks, keyed by their 1-based
   * target page number. A later declaration for the same page wins.
   */
  public Map<Integer, String> extractBackgroundVideos(List<ContentBlock> blocks) {
    Map<Integer, String> videosByPage = new TreeMap<>();
    for (ContentBlock block : blocks) {
      Element body = HtmlFragments.parseBody(block.html());
      for (Element video : body.select("video[" + MODE_ATTRIBUTE + "=" + MODE_BACKGROUND + "]")) {
        String src = videoSource(video);
        String target = video.attr(TARGET_PAGE_ATTRIBUTE).trim();
        if (src.isEmpty() || target.isEmpty()) {
          continue;
        }
        try {
          int page = Integer.parseInt(target);
          if (page > 0) {
            videosByPage.put(page, src);
          }
        } catch (NumberFormatException e) {
          LOGGER.warn(
              "Ignoring background video with invalid target page: chapter={}, target={}",
              block.chapterId(),
              target);
        }
      }
    }
    return videosByPage;
  }

  static String replaceLongDashes(String html) {
    return html.replace('\u2014', '-').replace('\u2013', '-');
  }

  private static String videoSource(Element video) {
    String src = video.attr("src");
    if (!src.isEmpty()) {
      return src;
    }
    Element source = video.selectFirst("source[src]");
    return source == null ? "" : source.attr("src");
  }
}
