package com.flamingo.ai.esgmaturity.domain.enums;

/** States of one resolution. {@link #RESOLVED} and {@link #EXHAUSTED} are terminal. */
public enum ResolutionState {
  SEARCHING,
  PRIORITIZING,
  DOWNLOADING,
  RESOLVED,
  EXHAUSTED;

  public boolean isTerminal() {
    return this == RESOLVED || this == EXHAUSTED;
  }
}
