package com.flamingo.ai.smartretrieval.exception;

/** Raised when the search collaborator cannot serve a retrieval. Retrieval never retries it. */
public class SearchException extends RuntimeException {

  private static final String USER_MESSAGE =
      "Search is temporarily unavailable. Please try again.";

  private final String index;

  public SearchException(String message) {
    super(message);
    this.index = null;
  }

  public SearchException(String index, Throwable cause) {
    super("Search failed on index " + index + ": " + cause.getMessage(), cause);
    this.index = index;
  }

  /** Index that failed, null when not index-specific. */
  public String getIndex() {
    return index;
  }

  public String getUserMessage() {
    return USER_MESSAGE;
  }
}
