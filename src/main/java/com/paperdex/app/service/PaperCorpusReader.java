package com.paperdex.app.service;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.paperdex.app.model.Paper;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import lombok.extern.log4j.Log4j2;

/** Reads a corpus file: one JSON array of paper objects. */
@Log4j2
public class PaperCorpusReader {

  private static final TypeReference<List<Paper>> PAPER_LIST = new TypeReference<>() {};

  private final ObjectMapper mapper;

  public PaperCorpusReader(ObjectMapper mapper) {
    this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
  }

  public List<Paper> read(Path path) throws IOException {
    try (InputStream in = Files.newInputStream(path)) {
      List<Paper> papers = read(in);
      log.info("corpus.read path={} papers={}", path, papers.size());
      return papers;
    }
  }

  public List<Paper> read(InputStream in) throws IOException {
    List<Paper> papers = mapper.readValue(in, PAPER_LIST);
    return papers == null ? List.of() : papers;
  }
}
