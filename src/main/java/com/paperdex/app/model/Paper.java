package com.paperdex.app.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Source paper record as read from the corpus file.
 *
 * <p>Field names follow the arXiv export format ({@code arxiv_id}, {@code published}, ...). Any of
 * the fields may be absent; the projector decides how each gap is handled.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class Paper {

  /** arXiv identifier, e.g. {@code 2401.01234}. Unique across the corpus. */
  @JsonProperty("arxiv_id")
  private String arxivId;

  private String title;

  /** Author names in publication order. */
  private List<String> authors;

  @JsonProperty("abstract")
  private String abstractText;

  /** Category codes such as {@code cs.LG}. */
  private List<String> categories;

  /** ISO-8601 publication timestamp. */
  private String published;
}
