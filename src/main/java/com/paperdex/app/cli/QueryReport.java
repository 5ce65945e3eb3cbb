package com.paperdex.app.cli;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.paperdex.app.repository.dynamodb.PaperItem;
import java.util.List;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Data;

/** JSON object printed by every query command. */
@Data
@AllArgsConstructor
@JsonPropertyOrder({"query_type", "parameters", "results", "count", "execution_time_ms"})
public class QueryReport {

  @JsonProperty("query_type")
  private String queryType;

  private Map<String, Object> parameters;

  private List<PaperItem> results;

  private int count;

  @JsonProperty("execution_time_ms")
  private long executionTimeMs;
}
