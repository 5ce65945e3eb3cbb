package com.paperdex.app.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.paperdex.app.model.ItemType;
import com.paperdex.app.model.LoadSummary;
import com.paperdex.app.model.Paper;
import com.paperdex.app.repository.PaperStoreException;
import com.paperdex.app.repository.dynamodb.PaperItem;
import com.paperdex.app.service.PaperCorpusReader;
import com.paperdex.app.service.PaperLoaderService;
import com.paperdex.app.service.PaperQueryService;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;
import lombok.extern.log4j.Log4j2;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Runs the loader or a single query when the process is started with a command, e.g. {@code load
 * papers.json} or {@code recent cs.LG --limit 5}. Without a command this runner does nothing and
 * the read API serves requests.
 *
 * <p>Query results go to stdout as one JSON object; logs go to stderr.
 */
@Log4j2
@Component
@Order(1)
public class PaperCommandRunner implements ApplicationRunner, ExitCodeGenerator {

  static final int EXIT_OK = 0;
  static final int EXIT_STORE_FAILURE = 1;
  static final int EXIT_USAGE = 2;

  private static final List<ItemType> REPORT_ORDER =
      List.of(
          ItemType.CATEGORY_ITEM,
          ItemType.AUTHOR_ITEM,
          ItemType.KEYWORD_ITEM,
          ItemType.PAPER_DETAIL);

  private final PaperQueryService queryService;
  private final PaperLoaderService loaderService;
  private final PaperCorpusReader corpusReader;
  private final ObjectMapper mapper;
  private final PrintStream out;
  private final PrintStream err;

  private int exitCode = EXIT_OK;

  @Autowired
  public PaperCommandRunner(
      PaperQueryService queryService,
      PaperLoaderService loaderService,
      PaperCorpusReader corpusReader,
      ObjectMapper mapper) {
    this(queryService, loaderService, corpusReader, mapper, System.out, System.err);
  }

  PaperCommandRunner(
      PaperQueryService queryService,
      PaperLoaderService loaderService,
      PaperCorpusReader corpusReader,
      ObjectMapper mapper,
      PrintStream out,
      PrintStream err) {
    this.queryService = queryService;
    this.loaderService = loaderService;
    this.corpusReader = corpusReader;
    this.mapper = mapper;
    this.out = out;
    this.err = err;
  }

  @Override
  public void run(ApplicationArguments args) {
    String[] raw = args.getSourceArgs();
    if (!CommandLineArgs.hasCommand(raw)) return;
    exitCode = execute(raw);
  }

  @Override
  public int getExitCode() {
    return exitCode;
  }

  /** Runs one command line and returns the process exit code. */
  int execute(String[] raw) {
    CommandLineArgs cli;
    try {
      cli = CommandLineArgs.parse(raw);
    } catch (UsageException e) {
      err.println("error: " + e.getMessage());
      err.println(PaperCommand.usageText());
      return EXIT_USAGE;
    }

    log.info(
        "cli.start command={} args={} limit={}",
        cli.getCommand(),
        cli.getArguments(),
        cli.getLimit());
    try {
      if (cli.getCommand() == PaperCommand.LOAD) {
        return load(Path.of(cli.getArguments().get(0)));
      }
      printJson(query(cli));
      return EXIT_OK;
    } catch (PaperStoreException e) {
      log.error(
          "cli.failed command={} operation={} key={}",
          cli.getCommand(),
          e.getOperation(),
          e.getKey(),
          e);
      err.println("error: " + e.getMessage());
      return EXIT_STORE_FAILURE;
    }
  }

  // ---------- load ----------

  private int load(Path path) {
    List<Paper> papers;
    try {
      out.println("Loading papers from " + path + "...");
      papers = corpusReader.read(path);
    } catch (IOException e) {
      log.error("cli.load unreadable path={} msg={}", path, e.getMessage(), e);
      err.println("error: cannot read " + path + ": " + e.getMessage());
      return EXIT_STORE_FAILURE;
    }

    LoadSummary summary = loaderService.load(papers, out::println);

    out.println("Loaded " + summary.getTotalPapers() + " papers");
    if (summary.getSkippedPapers() > 0) {
      out.println("Skipped " + summary.getSkippedPapers() + " papers without arxiv_id");
    }
    out.println("Created " + summary.totalItems() + " DynamoDB items (denormalized)");
    out.println(
        String.format(
            Locale.ROOT, "Denormalization factor: %.1fx", summary.denormalizationFactor()));
    out.println("Storage breakdown:");
    for (ItemType type : REPORT_ORDER) {
      out.println("  - " + type.label() + ": " + summary.count(type));
    }
    return EXIT_OK;
  }

  // ---------- queries ----------

  private QueryReport query(CommandLineArgs cli) {
    List<String> a = cli.getArguments();
    Map<String, Object> params = new LinkedHashMap<>();
    switch (cli.getCommand()) {
      case RECENT -> {
        int limit = limitOrDefault(cli);
        params.put("category", a.get(0));
        params.put("limit", limit);
        return timed(
            "recent_in_category", params, () -> queryService.recentInCategory(a.get(0), limit));
      }
      case AUTHOR -> {
        params.put("author_name", a.get(0));
        return timed("papers_by_author", params, () -> queryService.papersByAuthor(a.get(0)));
      }
      case GET -> {
        params.put("arxiv_id", a.get(0));
        return timed(
            "get_paper_by_id",
            params,
            () -> queryService.paperById(a.get(0)).map(List::of).orElseGet(List::of));
      }
      case DATERANGE -> {
        params.put("category", a.get(0));
        params.put("start_date", a.get(1));
        params.put("end_date", a.get(2));
        return timed(
            "papers_in_date_range",
            params,
            () -> queryService.papersInDateRange(a.get(0), a.get(1), a.get(2)));
      }
      case KEYWORD -> {
        int limit = limitOrDefault(cli);
        params.put("keyword", a.get(0));
        params.put("limit", limit);
        return timed(
            "papers_by_keyword", params, () -> queryService.papersByKeyword(a.get(0), limit));
      }
      default -> throw new IllegalStateException("not a query command: " + cli.getCommand());
    }
  }

  private int limitOrDefault(CommandLineArgs cli) {
    return Optional.ofNullable(cli.getLimit()).orElse(queryService.defaultLimit());
  }

  private static QueryReport timed(
      String queryType, Map<String, Object> params, Supplier<List<PaperItem>> query) {
    long t0 = System.nanoTime();
    List<PaperItem> results = query.get();
    long ms = (System.nanoTime() - t0) / 1_000_000;
    log.info(
        "cli.query type={} params={} count={} durationMs={}",
        queryType,
        params,
        results.size(),
        ms);
    return new QueryReport(queryType, params, results, results.size(), ms);
  }

  private void printJson(QueryReport report) {
    try {
      out.println(mapper.writeValueAsString(report));
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Failed to serialize query report: " + e.getMessage(), e);
    }
  }
}
