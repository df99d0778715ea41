package com.scholary.typesetter.pagination;

import com.scholary.typesetter.karaoke.KaraokeSlice;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Mutable pagination state of one chapter: the page being filled and the pages emitted so far.
 *
 * <p>Owned by a single pagination run and never shared between threads.
 */
public class ChapterPageState {

  private final ChapterContext context;
  private final List<Page> pages = new ArrayList<>();
  private final List<String> elements = new ArrayList<>();
  private final SortedSet<Integer> footnotes = new TreeSet<>();
  private final List<KaraokeSlice> slices = new ArrayList<>();
  private boolean hasHeading;
  private boolean overflowAccepted;
  private int pageIndex;

  public ChapterPageState(ChapterContext context) {
    this.context = context;
  }

  public ChapterContext context() {
    return context;
  }

  public void add(String html, Collection<Integer> footnoteNumbers) {
    elements.add(html);
    footnotes.addAll(footnoteNumbers);
  }

  public void addSlice(KaraokeSlice slice, String html, Collection<Integer> footnoteNumbers) {
    add(html, footnoteNumbers);
    slices.add(slice);
  }

  public boolean isEmpty() {
    return elements.isEmpty();
  }

  public List<String> elements() {
    return Collections.unmodifiableList(elements);
  }

  /** Elements of the current page followed by a candidate element. */
  public List<String> elementsWith(String html) {
    List<String> candidate = new ArrayList<>(elements);
    candidate.add(html);
    return candidate;
  }

  public SortedSet<Integer> footnotes() {
    return Collections.unmodifiableSortedSet(footnotes);
  }

  public List<KaraokeSlice> slices() {
    return Collections.unmodifiableList(slices);
  }

  public boolean hasHeading() {
    return hasHeading;
  }

  public void markHeading() {
    hasHeading = true;
  }

  public boolean overflowAccepted() {
    return overflowAccepted;
  }

  public void flagOverflow() {
    overflowAccepted = true;
  }

  /** Index the next emitted page will get. */
  public int pageIndex() {
    return pageIndex;
  }

  /** The first page chapter's page 0 is laid out with relaxed rules. */
  public boolean isStandaloneFirstPage() {
    return context.chapter().firstPage() && pageIndex == 0;
  }

  /** Clear the page being filled. */
  public void startNewPage(boolean initialHeading) {
    elements.clear();
    footnotes.clear();
    slices.clear();
    hasHeading = initialHeading;
    overflowAccepted = false;
  }

  void addPage(Page page) {
    pages.add(page);
    pageIndex++;
  }

  public List<Page> pages() {
    return Collections.unmodifiableList(pages);
  }
}
