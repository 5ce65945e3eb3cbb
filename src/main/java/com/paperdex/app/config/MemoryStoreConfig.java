package com.paperdex.app.config;

import com.paperdex.app.model.LoadSummary;
import com.paperdex.app.model.Paper;
import com.paperdex.app.repository.PaperStore;
import com.paperdex.app.repository.memory.InMemoryPaperStore;
import com.paperdex.app.service.PaperCorpusReader;
import com.paperdex.app.service.PaperLoaderService;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.List;
import lombok.extern.log4j.Log4j2;
import org.springframework.boot.ApplicationRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;
import org.springframework.core.annotation.Order;

/**
 * Store configuration for the {@code memory} profile: no AWS access, everything held in the
 * process. Optionally seeded from {@code paperindex.memory.seed-file} before any command runs.
 */
@Log4j2
@Configuration
@Profile("memory")
public class MemoryStoreConfig {

  @Bean
  public PaperStore paperStore(PaperIndexProperties props) {
    return new InMemoryPaperStore(props.getTableName(), props.getMemory().getPageSize());
  }

  @Bean
  @Order(0)
  public ApplicationRunner memoryStoreSeeder(
      PaperIndexProperties props, PaperCorpusReader reader, PaperLoaderService loader) {
    return args -> {
      String seedFile = props.getMemory().getSeedFile();
      if (seedFile == null || seedFile.isBlank()) return;
      try {
        List<Paper> papers = reader.read(Path.of(seedFile));
        LoadSummary summary = loader.load(papers);
        log.info(
            "memstore.seeded file={} papers={} items={}",
            seedFile,
            summary.getTotalPapers(),
            summary.totalItems());
      } catch (IOException e) {
        throw new UncheckedIOException("Failed to read seed file " + seedFile, e);
      }
    };
  }
}
