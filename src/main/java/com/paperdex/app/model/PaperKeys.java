package com.paperdex.app.model;

import java.util.Locale;

/**
 * Key layout of the paper table. Every partition/sort value written or queried goes through here so
 * the loader and the query side cannot drift apart.
 */
public final class PaperKeys {

  public static final String PAPER_PREFIX = "PAPER#";
  public static final String CATEGORY_PREFIX = "CATEGORY#";
  public static final String AUTHOR_ITEM_PREFIX = "AUTHORITEM#";
  public static final String AUTHOR_PREFIX = "AUTHOR#";
  public static final String KEYWORD_ITEM_PREFIX = "KEYWORDITEM#";
  public static final String KEYWORD_PREFIX = "KW#";

  /** Sort key of the single detail row per paper. */
  public static final String DETAIL_MARKER = "DETAIL";

  /** Sort-key date used when a record carries no publication timestamp. */
  public static final String MISSING_DATE = "0000-00-00";

  /**
   * Upper bound appended after the end date of a range query. Sorts after every character that can
   * appear in an arXiv id.
   */
  public static final String RANGE_HIGH_SENTINEL = "~";

  private static final char SEPARATOR = '#';

  private PaperKeys() {}

  public static String paper(String arxivId) {
    return PAPER_PREFIX + arxivId;
  }

  public static String category(String category) {
    return CATEGORY_PREFIX + category;
  }

  public static String authorItem(String author) {
    return AUTHOR_ITEM_PREFIX + author;
  }

  public static String author(String author) {
    return AUTHOR_PREFIX + author;
  }

  public static String keywordItem(String keyword) {
    return KEYWORD_ITEM_PREFIX + keyword;
  }

  /** Keyword index partition; case-insensitive by construction. */
  public static String keyword(String keyword) {
    return KEYWORD_PREFIX + keyword.toLowerCase(Locale.ROOT);
  }

  /** {@code <published_date>#<id>}: chronological order, ties broken by id. */
  public static String datedSortKey(String publishedDate, String arxivId) {
    return publishedDate + SEPARATOR + arxivId;
  }

  /** Lowest sort key of a date range, inclusive of every paper published on {@code startDate}. */
  public static String rangeStart(String startDate) {
    return startDate + SEPARATOR;
  }

  /** Highest sort key of a date range, inclusive of every paper published on {@code endDate}. */
  public static String rangeEnd(String endDate) {
    return endDate + SEPARATOR + RANGE_HIGH_SENTINEL;
  }

  /** Date part ({@code yyyy-MM-dd}) of an ISO timestamp, or {@link #MISSING_DATE}. */
  public static String publishedDate(String publishedIso) {
    if (publishedIso == null || publishedIso.isEmpty()) {
      return MISSING_DATE;
    }
    return publishedIso.length() > 10 ? publishedIso.substring(0, 10) : publishedIso;
  }
}
