package com.flamingo.ai.smartretrieval.service.rag.search;

import io.micrometer.core.instrument.MeterRegistry;
import java.util.concurrent.TimeUnit;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/** Publishes collaborator call metrics to Micrometer. */
@Component
@RequiredArgsConstructor
public class MeterRegistrySearchMetricsListener implements SearchMetricsListener {

  private final MeterRegistry meterRegistry;

  @Override
  public void onCall(SearchCallMetrics metrics) {
    String outcome = metrics.failed() ? "error" : "success";
    meterRegistry
        .counter("retrieval.collaborator.calls", "type", metrics.callType(), "outcome", outcome)
        .increment();
    meterRegistry
        .timer("retrieval.collaborator.duration", "type", metrics.callType())
        .record(metrics.durationMs(), TimeUnit.MILLISECONDS);
    if (metrics.inputTokens() > 0) {
      meterRegistry
          .counter("retrieval.collaborator.tokens", "type", metrics.callType())
          .increment(metrics.inputTokens());
    }
  }
}
