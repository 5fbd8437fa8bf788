package com.flamingo.ai.esgmaturity.domain.enums;

/** Why a unit of work in a batch produced no score. */
public enum UnitErrorType {
  RESOLUTION_FAILED,
  EXTRACTION_FAILED,
  INVALID_INPUT,
  PARITY_VIOLATION,
  CANCELLED,
  REJECTED,
  INTERNAL
}
