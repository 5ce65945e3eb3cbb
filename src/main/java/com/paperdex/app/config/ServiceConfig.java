package com.paperdex.app.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.paperdex.app.repository.PaperStore;
import com.paperdex.app.service.KeywordExtractor;
import com.paperdex.app.service.PaperCorpusReader;
import com.paperdex.app.service.PaperItemProjector;
import com.paperdex.app.service.PaperLoaderService;
import com.paperdex.app.service.PaperQueryService;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@RequiredArgsConstructor
public class ServiceConfig {

  private final PaperStore paperStore;
  private final PaperIndexProperties props;

  // -------------------
  // Write path
  // -------------------

  @Bean
  public KeywordExtractor keywordExtractor() {
    return new KeywordExtractor(props.getKeywordLimit());
  }

  @Bean
  public PaperItemProjector paperItemProjector(KeywordExtractor keywordExtractor) {
    return new PaperItemProjector(keywordExtractor);
  }

  @Bean
  public PaperCorpusReader paperCorpusReader(ObjectMapper objectMapper) {
    return new PaperCorpusReader(objectMapper);
  }

  @Bean
  public PaperLoaderService paperLoaderService(PaperItemProjector projector) {
    return new PaperLoaderService(
        paperStore,
        projector,
        props.getBatchSize(),
        props.getWrite().getMaxAttempts(),
        props.getWrite().getInitialBackoff());
  }

  // -------------------
  // Read path
  // -------------------

  @Bean
  public PaperQueryService paperQueryService() {
    return new PaperQueryService(paperStore, props.getDefaultQueryLimit());
  }
}
