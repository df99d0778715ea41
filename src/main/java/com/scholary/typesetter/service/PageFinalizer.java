package com.scholary.typesetter.service;

import com.scholary.typesetter.pagination.Page;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Sets chapter page totals and fixes the position of the first page and the cover. */
public final class PageFinalizer {

  private static final Logger LOGGER = LoggerFactory.getLogger(PageFinalizer.class);

  private PageFinalizer() {}

  public static List<Page> finalizePages(List<Page> pages) {
    return order(withTotals(pages));
  }

  /**
   * Every page of a regular chapter gets the page count of its chapter. Pages are counted per
   * chapter id; chapter order values are not unique. Cover pages are not counted and neither
   * cover nor first page receive a total.
   */
  static List<Page> withTotals(List<Page> pages) {
    Map<String, Integer> pagesPerChapter = new HashMap<>();
    for (Page page : pages) {
      if (!page.cover()) {
        pagesPerChapter.merge(page.chapterId(), 1, Integer::sum);
      }
    }
    List<Page> result = new ArrayList<>(pages.size());
    for (Page page : pages) {
      if (page.cover() || page.firstPage()) {
        result.add(page);
      } else {
        result.add(page.withTotalPages(pagesPerChapter.getOrDefault(page.chapterId(), 1)));
      }
    }
    return result;
  }

  /** First page pages lead, cover pages follow, everything else keeps its order. */
  static List<Page> order(List<Page> pages) {
    List<Page> firstPages = new ArrayList<>();
    List<Page> covers = new ArrayList<>();
    List<Page> rest = new ArrayList<>();
    for (Page page : pages) {
      if (page.firstPage()) {
        firstPages.add(page);
      } else if (page.cover()) {
        covers.add(page);
      } else {
        rest.add(page);
      }
    }
    List<Page> ordered = new ArrayList<>(pages.size());
    ordered.addAll(firstPages);
    ordered.addAll(covers);
    ordered.addAll(rest);
    if (!ordered.equals(pages)) {
      LOGGER.warn("Page order corrected: first page and cover moved to the front");
    }
    return ordered;
  }
}
