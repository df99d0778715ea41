package com.scholary.typesetter.service;

/** A newer pagination run started before this one finished. */
public class PaginationSupersededException extends RuntimeException {

  public PaginationSupersededException(String message) {
    super(message);
  }

  public PaginationSupersededException(String message, Throwable cause) {
    super(message, cause);
  }
}
