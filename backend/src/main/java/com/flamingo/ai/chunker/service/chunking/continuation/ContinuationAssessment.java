package com.flamingo.ai.chunker.service.chunking.continuation;

import java.util.Set;

/**
 * Signals that fired at one page boundary.
 *
 * @param signals fired signals; empty when the boundary looks like a genuine break
 */
public record ContinuationAssessment(Set<ContinuationSignal> signals) {

  public ContinuationAssessment {
    signals = Set.copyOf(signals);
  }

  public static ContinuationAssessment none() {
    return new ContinuationAssessment(Set.of());
  }

  /** Any single signal is enough. */
  public boolean isContinuation() {
    return !signals.isEmpty();
  }
}
