package com.paperdex.app.api;

import com.paperdex.app.api.PaperResponses.AuthorPapers;
import com.paperdex.app.api.PaperResponses.CategoryPapers;
import com.paperdex.app.api.PaperResponses.DateRangePapers;
import com.paperdex.app.api.PaperResponses.KeywordPapers;
import com.paperdex.app.service.PaperQueryService;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.constraints.Min;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Read-only HTTP API over the five query patterns. Path segments arrive URL-decoded. The
 * parameters of each request are handed to {@link RequestLoggingFilter} for the access log line.
 */
@Log4j2
@Validated
@RestController
@RequestMapping(path = "/papers", produces = MediaType.APPLICATION_JSON_VALUE)
@RequiredArgsConstructor
public class PaperController {

  private final PaperQueryService queryService;

  // ------------------------------------------------------------
  // /papers/recent?category=&limit=
  // ------------------------------------------------------------
  @GetMapping("/recent")
  public CategoryPapers recent(
      @RequestParam(name = "category", required = false) String category,
      @RequestParam(name = "limit", required = false) @Min(value = 1, message = "invalid limit")
          Integer limit,
      HttpServletRequest request) {
    require(category, "missing category");
    int cap = limit == null ? queryService.defaultLimit() : limit;
    logParams(request, "category", category, "limit", cap);
    return CategoryPapers.of(category, queryService.recentInCategory(category, cap));
  }

  // ------------------------------------------------------------
  // /papers/author/{authorName}
  // ------------------------------------------------------------
  @GetMapping("/author/{authorName}")
  public AuthorPapers byAuthor(
      @PathVariable("authorName") String authorName, HttpServletRequest request) {
    require(authorName, "missing author_name");
    logParams(request, "author_name", authorName);
    return AuthorPapers.of(authorName, queryService.papersByAuthor(authorName));
  }

  @GetMapping("/author/")
  public AuthorPapers byAuthorMissing() {
    throw new InvalidQueryException("missing author_name");
  }

  // ------------------------------------------------------------
  // /papers/keyword/{keyword}?limit=
  // ------------------------------------------------------------
  @GetMapping("/keyword/{keyword}")
  public KeywordPapers byKeyword(
      @PathVariable("keyword") String keyword,
      @RequestParam(name = "limit", required = false) @Min(value = 1, message = "invalid limit")
          Integer limit,
      HttpServletRequest request) {
    require(keyword, "missing keyword");
    int cap = limit == null ? queryService.defaultLimit() : limit;
    logParams(request, "keyword", keyword, "limit", cap);
    return KeywordPapers.of(keyword, queryService.papersByKeyword(keyword, cap));
  }

  @GetMapping("/keyword/")
  public KeywordPapers byKeywordMissing() {
    throw new InvalidQueryException("missing keyword");
  }

  // ------------------------------------------------------------
  // /papers/search?category=&start=&end=
  // ------------------------------------------------------------
  @GetMapping("/search")
  public DateRangePapers search(
      @RequestParam(name = "category", required = false) String category,
      @RequestParam(name = "start", required = false) String start,
      @RequestParam(name = "end", required = false) String end,
      HttpServletRequest request) {
    if (isBlank(category) || isBlank(start) || isBlank(end)) {
      throw new InvalidQueryException("missing category/start/end");
    }
    logParams(request, "category", category, "start", start, "end", end);
    return DateRangePapers.of(
        category, start, end, queryService.papersInDateRange(category, start, end));
  }

  // ------------------------------------------------------------
  // /papers/{arxivId}; old-style ids such as hep-th/9901001 contain a slash
  // ------------------------------------------------------------
  @GetMapping("/{*arxivId}")
  public ResponseEntity<?> byId(
      @PathVariable("arxivId") String arxivId, HttpServletRequest request) {
    String id = arxivId.startsWith("/") ? arxivId.substring(1) : arxivId;
    require(id, "missing arxiv_id");
    logParams(request, "arxiv_id", id);
    return queryService
        .paperById(id)
        .<ResponseEntity<?>>map(ResponseEntity::ok)
        .orElseGet(
            () -> {
              log.debug("api.byId arxivId={} not found", id);
              return ResponseEntity.status(HttpStatus.NOT_FOUND).body(new ApiError("not found"));
            });
  }

  // -------- helpers --------

  private static void require(String value, String reason) {
    if (isBlank(value)) {
      throw new InvalidQueryException(reason);
    }
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }

  private static void logParams(HttpServletRequest request, Object... keyValues) {
    Map<String, Object> params = new LinkedHashMap<>();
    for (int i = 0; i + 1 < keyValues.length; i += 2) {
      params.put(String.valueOf(keyValues[i]), keyValues[i + 1]);
    }
    request.setAttribute(RequestLoggingFilter.PARAMS_ATTRIBUTE, params);
  }
}
