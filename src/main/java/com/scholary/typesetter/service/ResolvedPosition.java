package com.scholary.typesetter.service;

/**
 * A reading position located in a page list.
 *
 * @param flatIndex index into the page list
 * @param chapterIndex chapter index of the page
 * @param pageIndex page index within the chapter
 */
public record ResolvedPosition(int flatIndex, int chapterIndex, int pageIndex) {

  public static final ResolvedPosition START = new ResolvedPosition(0, 0, 0);
}
