package com.flamingo.ai.esgmaturity.service.determinism;

import com.google.common.hash.HashCode;
import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;
import java.nio.charset.StandardCharsets;

/**
 * Fixed, versioned hashing used wherever an identifier or tie-break must be reproducible. Never
 * relies on {@link Object#hashCode()}.
 */
public final class StableHash {

  /** Recorded in snapshot ids; bump when the hash function or part encoding changes. */
  public static final String VERSION = "sha256-v1";

  private static final HashFunction SHA256 = Hashing.sha256();
  private static final char SEPARATOR = '\u001f';

  private StableHash() {}

  public static String hex(byte[] bytes) {
    return SHA256.hashBytes(bytes).toString();
  }

  /** Hashes the UTF-8 encoding of the parts joined by the ASCII unit separator. */
  public static String hex(Object... parts) {
    return hashParts(parts).toString();
  }

  /** First eight bytes of the digest as a long. */
  public static long asLong(Object... parts) {
    return hashParts(parts).asLong();
  }

  /** {@code prefix-} followed by the first 16 hex characters of the digest. */
  public static String shortId(String prefix, Object... parts) {
    return prefix + "-" + hex(parts).substring(0, 16);
  }

  private static HashCode hashParts(Object... parts) {
    StringBuilder joined = new StringBuilder();
    for (int i = 0; i < parts.length; i++) {
      if (i > 0) {
        joined.append(SEPARATOR);
      }
      joined.append(parts[i]);
    }
    return SHA256.hashString(joined, StandardCharsets.UTF_8);
  }
}
