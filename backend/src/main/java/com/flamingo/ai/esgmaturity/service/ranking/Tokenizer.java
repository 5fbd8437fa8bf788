package com.flamingo.ai.esgmaturity.service.ranking;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Lowercased word tokens, shared by the lexical and semantic scorers. */
public final class Tokenizer {

  private static final Pattern WORD = Pattern.compile("\\w+", Pattern.UNICODE_CHARACTER_CLASS);

  private Tokenizer() {}

  public static List<String> tokens(String text) {
    List<String> tokens = new ArrayList<>();
    if (text == null) {
      return tokens;
    }
    Matcher matcher = WORD.matcher(text.toLowerCase(Locale.ROOT));
    while (matcher.find()) {
      tokens.add(matcher.group());
    }
    return tokens;
  }

  /** Distinct tokens in sorted order. */
  public static Set<String> tokenSet(String text) {
    return new TreeSet<>(tokens(text));
  }
}
