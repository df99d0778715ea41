package com.scholary.typesetter.pagination;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.scholary.typesetter.content.Epigraph;
import com.scholary.typesetter.footnote.Footnote;
import com.scholary.typesetter.karaoke.KaraokeSlice;
import java.util.List;

/**
 * One rendered page of the book.
 *
 * <p>Text pages carry their content wrapped in the page wrapper with its bottom padding, followed
 * by the footnote section. Epigraph, video, field notes and empty pages carry empty or fixed
 * content and are flagged accordingly.
 *
 * @param chapterIndex -2 for the first page, -1 for the cover, otherwise the chapter order
 * @param chapterId owning chapter
 * @param chapterTitle owning chapter title
 * @param subchapterId subchapter the content came from, if any
 * @param subchapterTitle subchapter title, if the content came from a subchapter
 * @param pageIndex position within the chapter, starting at 0
 * @param hasHeading whether the page carries a heading
 * @param hasFieldNotes whether this is a field notes page
 * @param fieldNotesImageUrl image shown on a field notes page
 * @param content rendered HTML
 * @param footnotes footnotes listed on this page, by number
 * @param backgroundVideo background video matched by page number
 * @param backgroundImageUrl chapter background image
 * @param firstPage whether the page belongs to the standalone first page chapter
 * @param cover whether the page belongs to the cover chapter
 * @param epigraphPage whether this is an epigraph page
 * @param epigraph epigraph shown on an epigraph page
 * @param videoPage whether this is a blank-page video page
 * @param videoSrc video shown on a video page
 * @param totalPages pages in the chapter, set when the run is finalized
 * @param karaokeSlices karaoke slices placed on this page
 * @param overflowAccepted whether content was kept despite exceeding the available height
 */
public record Page(
    int chapterIndex,
    String chapterId,
    String chapterTitle,
    String subchapterId,
    String subchapterTitle,
    int pageIndex,
    boolean hasHeading,
    boolean hasFieldNotes,
    String fieldNotesImageUrl,
    String content,
    List<Footnote> footnotes,
    String backgroundVideo,
    String backgroundImageUrl,
    @JsonProperty("isFirstPage") boolean firstPage,
    @JsonProperty("isCover") boolean cover,
    @JsonProperty("isEpigraph") boolean epigraphPage,
    Epigraph epigraph,
    @JsonProperty("isVideo") boolean videoPage,
    String videoSrc,
    Integer totalPages,
    List<KaraokeSlice> karaokeSlices,
    boolean overflowAccepted) {

  public Page {
    content = content == null ? "" : content;
    footnotes = footnotes == null ? List.of() : List.copyOf(footnotes);
    karaokeSlices = karaokeSlices == null ? List.of() : List.copyOf(karaokeSlices);
  }

  public Page withTotalPages(Integer total) {
    return toBuilder().totalPages(total).build();
  }

  public Page withContent(String newContent) {
    return toBuilder().content(newContent).build();
  }

  /** Whether the page is laid out from flowed text, as opposed to a fixed special page. */
  @JsonIgnore
  public boolean isTextPage() {
    return !epigraphPage && !videoPage && !hasFieldNotes;
  }

  public static Builder builder() {
    return new Builder();
  }

  public Builder toBuilder() {
    return new Builder()
        .chapterIndex(chapterIndex)
        .chapterId(chapterId)
        .chapterTitle(chapterTitle)
        .subchapterId(subchapterId)
        .subchapterTitle(subchapterTitle)
        .pageIndex(pageIndex)
        .hasHeading(hasHeading)
        .hasFieldNotes(hasFieldNotes)
        .fieldNotesImageUrl(fieldNotesImageUrl)
        .content(content)
        .footnotes(footnotes)
        .backgroundVideo(backgroundVideo)
        .backgroundImageUrl(backgroundImageUrl)
        .firstPage(firstPage)
        .cover(cover)
        .epigraphPage(epigraphPage)
        .epigraph(epigraph)
        .videoPage(videoPage)
        .videoSrc(videoSrc)
        .totalPages(totalPages)
        .karaokeSlices(karaokeSlices)
        .overflowAccepted(overflowAccepted);
  }

  public static final class Builder {
    private int chapterIndex;
    private String chapterId;
    private String chapterTitle;
    private String subchapterId;
    private String subchapterTitle;
    private int pageIndex;
    private boolean hasHeading;
    private boolean hasFieldNotes;
    private String fieldNotesImageUrl;
    private String content = "";
    private List<Footnote> footnotes = List.of();
    private String backgroundVideo;
    private String backgroundImageUrl;
    private boolean firstPage;
    private boolean cover;
    private boolean epigraphPage;
    private Epigraph epigraph;
    private boolean videoPage;
    private String videoSrc;
    private Integer totalPages;
    private List<KaraokeSlice> karaokeSlices = List.of();
    private boolean overflowAccepted;

    private Builder() {}

    public Builder chapterIndex(int chapterIndex) {
      this.chapterIndex = chapterIndex;
      return this;
    }

    public Builder chapterId(String chapterId) {
      this.chapterId = chapterId;
      return this;
    }

    public Builder chapterTitle(String chapterTitle) {
      this.chapterTitle = chapterTitle;
      return this;
    }

    public Builder subchapterId(String subchapterId) {
      this.subchapterId = subchapterId;
      return this;
    }

    public Builder subchapterTitle(String subchapterTitle) {
      this.subchapterTitle = subchapterTitle;
      return this;
    }

    public Builder pageIndex(int pageIndex) {
      this.pageIndex = pageIndex;
      return this;
    }

    public Builder hasHeading(boolean hasHeading) {
      this.hasHeading = hasHeading;
      return this;
    }

    public Builder hasFieldNotes(boolean hasFieldNotes) {
      this.hasFieldNotes = hasFieldNotes;
      return this;
    }

    public Builder fieldNotesImageUrl(String fieldNotesImageUrl) {
      this.fieldNotesImageUrl = fieldNotesImageUrl;
      return this;
    }

    public Builder content(String content) {
      this.content = content;
      return this;
    }

    public Builder footnotes(List<Footnote> footnotes) {
      this.footnotes = footnotes;
      return this;
    }

    public Builder backgroundVideo(String backgroundVideo) {
      this.backgroundVideo = backgroundVideo;
      return this;
    }

    public Builder backgroundImageUrl(String backgroundImageUrl) {
      this.backgroundImageUrl = backgroundImageUrl;
      return this;
    }

    public Builder firstPage(boolean firstPage) {
      this.firstPage = firstPage;
      return this;
    }

    public Builder cover(boolean cover) {
      this.cover = cover;
      return this;
    }

    public Builder epigraphPage(boolean epigraphPage) {
      this.epigraphPage = epigraphPage;
      return this;
    }

    public Builder epigraph(Epigraph epigraph) {
      this.epigraph = epigraph;
      return this;
    }

    public Builder videoPage(boolean videoPage) {
      this.videoPage = videoPage;
      return this;
    }

    public Builder videoSrc(String videoSrc) {
      this.videoSrc = videoSrc;
      return this;
    }

    public Builder totalPages(Integer totalPages) {
      this.totalPages = totalPages;
      return this;
    }

    public Builder karaokeSlices(List<KaraokeSlice> karaokeSlices) {
      this.karaokeSlices = karaokeSlices;
      return this;
    }

    public Builder overflowAccepted(boolean overflowAccepted) {
      this.overflowAccepted = overflowAccepted;
      return this;
    }

    public Page build() {
      return new Page(
          chapterIndex,
          chapterId,
          chapterTitle,
          subchapterId,
          subchapterTitle,
          pageIndex,
          hasHeading,
          hasFieldNotes,
          fieldNotesImageUrl,
          content,
          footnotes,
          backgroundVideo,
          backgroundImageUrl,
          firstPage,
          cover,
          epigraphPage,
          epigraph,
          videoPage,
          videoSrc,
          totalPages,
          karaokeSlices,
          overflowAccepted);
    }
  }
}
