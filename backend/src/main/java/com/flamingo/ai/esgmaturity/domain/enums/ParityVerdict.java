package com.flamingo.ai.esgmaturity.domain.enums;

/** Outcome of the evidence-in-top-K check. */
public enum ParityVerdict {
  PASS,
  FAIL
}
