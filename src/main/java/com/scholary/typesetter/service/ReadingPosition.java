package com.scholary.typesetter.service;

/**
 * A saved place in the book.
 *
 * @param chapterId chapter the reader was in, null for the start of the book
 * @param pageIndex page within the chapter, null for its first page
 */
public record ReadingPosition(String chapterId, Integer pageIndex) {}
