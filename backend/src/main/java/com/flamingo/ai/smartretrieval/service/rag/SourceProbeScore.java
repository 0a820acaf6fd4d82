package com.flamingo.ai.smartretrieval.service.rag;

/** Per-source aggregate of probe-stage scores. Lives for one two-stage search only. */
record SourceProbeScore(String source, double totalScore, int count) {

  static SourceProbeScore of(String source, double score) {
    return new SourceProbeScore(source, score, 1);
  }

  SourceProbeScore plus(SourceProbeScore other) {
    return new SourceProbeScore(source, totalScore + other.totalScore, count + other.count);
  }

  double avgScore() {
    return totalScore / count;
  }
}
