package com.flamingo.ai.esgmaturity.domain.enums;

/** Closed set of provider implementations that can be registered at startup. */
public enum ProviderType {
  LOCAL_FILE,
  HTTP_REPORT
}
