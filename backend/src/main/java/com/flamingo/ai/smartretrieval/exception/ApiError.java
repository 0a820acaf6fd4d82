package com.flamingo.ai.smartretrieval.exception;

import java.time.Instant;
import lombok.Builder;
import lombok.Getter;

/** Structured API error response. */
@Getter
@Builder
public class ApiError {

  public static final String SEARCH_FAILED = "SEARCH_001";
  public static final String INVALID_ARGUMENT = "REQUEST_001";
  public static final String VALIDATION_ERROR = "VALIDATION_001";
  public static final String INTERNAL_ERROR = "INTERNAL_001";

  /** Unique error ID for log correlation. */
  private final String errorId;

  private final String code;

  /** User-facing message. */
  private final String message;

  private final Instant timestamp;
  private final String path;
}
