package com.flamingo.ai.smartretrieval.domain.enums;

/** Domain guess for a user query, based on vocabulary matches. */
public enum QueryType {
  BOOK,
  DOCUMENT,
  GENERAL,
  MIXED
}
