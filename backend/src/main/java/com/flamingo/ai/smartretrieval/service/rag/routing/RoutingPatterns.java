package com.flamingo.ai.smartretrieval.service.rag.routing;

import java.util.regex.Pattern;

/**
 * Signal patterns and word-count thresholds used by {@link QueryRouter}. Patterns are matched
 * against the trimmed query.
 *
 * @param definitional definitional prefix ("what is", "define", ...)
 * @param anaphora markers that make a query depend on earlier turns
 * @param counting counting requests
 * @param listRequest list-request prefix
 * @param analytical analytical verbs
 * @param shortQueryMaxWords queries with at most this many words are short
 * @param longQueryMinWords queries with more than this many words are long
 */
public record RoutingPatterns(
    Pattern definitional,
    Pattern anaphora,
    Pattern counting,
    Pattern listRequest,
    Pattern analytical,
    int shortQueryMaxWords,
    int longQueryMinWords) {

  public static RoutingPatterns defaults() {
    return new RoutingPatterns(
        Pattern.compile("^(what is|who is|when is|where is|define)", Pattern.CASE_INSENSITIVE),
        Pattern.compile(
            "\\b(it|this|that|these|those|they|them|he|she|his|her|their"
                + "|what about|how about|and)\\b",
            Pattern.CASE_INSENSITIVE),
        Pattern.compile("\\b(how many|count|total|number of)\\b", Pattern.CASE_INSENSITIVE),
        Pattern.compile("^(list|show me|give me|find)\\s", Pattern.CASE_INSENSITIVE),
        Pattern.compile(
            "\\b(why|how|explain|analyze|compare|discuss|elaborate)\\b", Pattern.CASE_INSENSITIVE),
        8,
        20);
  }
}
