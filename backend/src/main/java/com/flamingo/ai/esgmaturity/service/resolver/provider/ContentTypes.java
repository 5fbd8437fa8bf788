package com.flamingo.ai.esgmaturity.service.resolver.provider;

import java.util.Locale;
import java.util.Map;

/** File-extension to MIME type mapping shared by the providers. */
final class ContentTypes {

  private static final Map<String, String> BY_EXTENSION =
      Map.of(
          "txt", "text/plain",
          "md", "text/markdown",
          "html", "text/html",
          "htm", "text/html",
          "json", "application/json",
          "pdf", "application/pdf");

  private static final Map<String, String> EXTENSION_BY_TYPE =
      Map.of(
          "text/plain", "txt",
          "text/markdown", "md",
          "text/html", "html",
          "application/json", "json",
          "application/pdf", "pdf");

  private ContentTypes() {}

  static String forFileName(String fileName, String fallback) {
    int dot = fileName.lastIndexOf('.');
    if (dot < 0 || dot == fileName.length() - 1) {
      return fallback;
    }
    return BY_EXTENSION.getOrDefault(
        fileName.substring(dot + 1).toLowerCase(Locale.ROOT), fallback);
  }

  static String extensionFor(String contentType) {
    return EXTENSION_BY_TYPE.getOrDefault(contentType, "bin");
  }
}
