package com.flamingo.ai.esgmaturity.domain.enums;

/** How a provider reaches a report. */
public enum AccessMethod {
  /** Structured API of a data provider. */
  API,

  /** Scraped from a web page. */
  SCRAPE,

  /** Local file that was ingested earlier. */
  FILE
}
