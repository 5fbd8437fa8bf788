package com.flamingo.ai.esgmaturity.exception;

import java.time.Instant;
import lombok.Builder;
import lombok.Getter;

/** Structured API error response. */
@Getter
@Builder
public class ApiError {

  // Error codes
  public static final String INVALID_INPUT = "INPUT_001";
  public static final String RESOLUTION_FAILED = "RESOLUTION_001";
  public static final String EXTRACTION_FAILED = "EXTRACTION_001";
  public static final String PARITY_VIOLATION = "PARITY_001";
  public static final String CONFIG_ERROR = "CONFIG_001";
  public static final String ARTIFACT_ERROR = "ARTIFACT_001";
  public static final String VALIDATION_ERROR = "VALIDATION_001";
  public static final String MALFORMED_REQUEST = "VALIDATION_002";
  public static final String INTERNAL_ERROR = "INTERNAL_001";

  /** Unique error ID for log correlation. */
  private final String errorId;

  /** Machine-readable error code. */
  private final String code;

  /** User-friendly error message. */
  private final String message;

  /** Technical details, such as missing evidence ids. */
  private final String details;

  /** Timestamp of the error. */
  private final Instant timestamp;

  /** Request path that caused the error. */
  private final String path;
}
