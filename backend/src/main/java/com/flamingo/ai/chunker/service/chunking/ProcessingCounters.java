package com.flamingo.ai.chunker.service.chunking;

import lombok.Getter;

/** Outcome counters of chunk acceptance for one page. Not shared between threads. */
@Getter
public class ProcessingCounters {

  private int duplicatesPrevented;
  private int validationFailures;

  void recordDuplicate() {
    duplicatesPrevented++;
  }

  void recordValidationFailure() {
    validationFailures++;
  }
}
