package com.paperdex.app.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/** Settings under {@code paperindex.*}. */
@Data
@Validated
@ConfigurationProperties(prefix = "paperindex")
public class PaperIndexProperties {

  /** Target table; defaults to {@code $DDB_TABLE} in application.yml. */
  @NotBlank private String tableName = "arxiv-papers";

  /** Items per BatchWriteItem request. */
  @Min(1)
  @Max(25)
  private int batchSize = 25;

  /** Keywords kept per abstract. */
  @Min(0)
  private int keywordLimit = 10;

  /** Page cap for the recent and keyword queries when the caller gives none. */
  @Min(1)
  private int defaultQueryLimit = 20;

  @Valid private Write write = new Write();

  @Valid private Provision provision = new Provision();

  @Valid private Memory memory = new Memory();

  @Data
  public static class Write {
    /** Attempts per batch, counting retries of unprocessed items. */
    @Min(1)
    private int maxAttempts = 5;

    /** First retry delay; doubled on every further attempt. */
    @NotNull private Duration initialBackoff = Duration.ofMillis(100);
  }

  @Data
  public static class Provision {
    @NotNull private Duration pollInterval = Duration.ofSeconds(2);

    @NotNull private Duration maxWait = Duration.ofMinutes(5);
  }

  @Data
  public static class Memory {
    /** Items per query page, mirroring DynamoDB's 1 MB page boundary. */
    @Min(1)
    private int pageSize = 100;

    /** Optional JSON corpus loaded into the store at startup. */
    private String seedFile;
  }
}
