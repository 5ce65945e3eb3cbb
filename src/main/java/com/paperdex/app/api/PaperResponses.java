package com.paperdex.app.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.paperdex.app.repository.dynamodb.PaperItem;
import java.util.List;
import lombok.Value;

/** Response bodies of the read API. {@code count} is always the size of {@code papers}. */
public final class PaperResponses {

  private PaperResponses() {}

  @Value
  @JsonPropertyOrder({"category", "papers", "count"})
  public static class CategoryPapers {
    String category;
    List<PaperItem> papers;
    int count;

    public static CategoryPapers of(String category, List<PaperItem> papers) {
      return new CategoryPapers(category, papers, papers.size());
    }
  }

  @Value
  @JsonPropertyOrder({"author_name", "papers", "count"})
  public static class AuthorPapers {
    @JsonProperty("author_name")
    String authorName;

    List<PaperItem> papers;
    int count;

    public static AuthorPapers of(String authorName, List<PaperItem> papers) {
      return new AuthorPapers(authorName, papers, papers.size());
    }
  }

  @Value
  @JsonPropertyOrder({"keyword", "papers", "count"})
  public static class KeywordPapers {
    String keyword;
    List<PaperItem> papers;
    int count;

    public static KeywordPapers of(String keyword, List<PaperItem> papers) {
      return new KeywordPapers(keyword, papers, papers.size());
    }
  }

  @Value
  @JsonPropertyOrder({"category", "start", "end", "papers", "count"})
  public static class DateRangePapers {
    String category;
    String start;
    String end;
    List<PaperItem> papers;
    int count;

    public static DateRangePapers of(
        String category, String start, String end, List<PaperItem> papers) {
      return new DateRangePapers(category, start, end, papers, papers.size());
    }
  }
}
