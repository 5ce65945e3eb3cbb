package com.paperdex.app.service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Picks the most frequent content words of a text.
 *
 * <p>Tokens are maximal runs of ASCII letters, lower-cased; tokens of two letters or fewer and stop
 * words are dropped. Results are ordered by descending frequency, ties in order of first
 * appearance. Pure and thread-safe.
 */
public class KeywordExtractor {

  private static final Pattern WORD = Pattern.compile("[a-zA-Z]+");

  private static final Set<String> STOP_WORDS =
      Set.of(
          "the", "a", "an", "and", "or", "but", "in", "on", "at", "to", "for", "of", "with", "by",
          "from", "up", "about", "into", "through", "during", "is", "are", "was", "were", "be",
          "been", "being", "have", "has", "had", "do", "does", "did", "will", "would", "could",
          "should", "may", "might", "can", "this", "that", "these", "those", "we", "our", "use",
          "using", "based", "approach", "method", "paper", "propose", "proposed", "show");

  private final int maxKeywords;

  public KeywordExtractor(int maxKeywords) {
    if (maxKeywords < 0) {
      throw new IllegalArgumentException("maxKeywords must not be negative: " + maxKeywords);
    }
    this.maxKeywords = maxKeywords;
  }

  public int maxKeywords() {
    return maxKeywords;
  }

  /** Content tokens of {@code text} in reading order; empty for null or blank text. */
  public List<String> tokenize(String text) {
    List<String> tokens = new ArrayList<>();
    if (text == null || text.isEmpty()) return tokens;
    Matcher m = WORD.matcher(text.toLowerCase(Locale.ROOT));
    while (m.find()) {
      String token = m.group();
      if (token.length() > 2 && !STOP_WORDS.contains(token)) {
        tokens.add(token);
      }
    }
    return tokens;
  }

  /** Up to {@code maxKeywords} distinct keywords of {@code text}, most frequent first. */
  public List<String> extract(String text) {
    // insertion order doubles as the first-seen tie-breaker
    Map<String, Integer> counts = new LinkedHashMap<>();
    for (String token : tokenize(text)) {
      counts.merge(token, 1, Integer::sum);
    }
    List<Map.Entry<String, Integer>> ranked = new ArrayList<>(counts.entrySet());
    ranked.sort(Map.Entry.<String, Integer>comparingByValue().reversed());

    List<String> keywords = new ArrayList<>(Math.min(maxKeywords, ranked.size()));
    for (Map.Entry<String, Integer> e : ranked) {
      if (keywords.size() == maxKeywords) break;
      keywords.add(e.getKey());
    }
    return keywords;
  }
}
