/**
 * Store configuration package for the paper index service.
 *
 * <p>Contains Spring configuration classes for the DynamoDB client and the {@code PaperStore}.
 */
package com.paperdex.app.config;

import com.paperdex.app.repository.PaperStore;
import com.paperdex.app.repository.dynamodb.DynamoDbPaperStore;
import java.net.URI;
import lombok.extern.log4j.Log4j2;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.DynamoDbClientBuilder;

/**
 * AWS configuration for the local environment.
 *
 * <p>Uses static credentials from the application properties and, when {@code
 * aws.dynamodb.endpoint} is set, points the client at that endpoint (DynamoDB Local). Defines:
 *
 * <ul>
 *   <li>{@link DynamoDbClient} - the single, process-wide client.
 *   <li>{@link PaperStore} - the DynamoDB-backed store shared by the loader, the CLI and the API.
 * </ul>
 *
 * <p>Active only when the {@code local} Spring profile is enabled.
 */
@Log4j2
@Configuration
@Profile("local")
public class AwsLocalConfig {

  /** AWS region in which the client will operate. */
  @Value("${aws.region}")
  private String region;

  /** AWS access key ID for local development. */
  @Value("${aws.accessKeyId}")
  private String accessKeyId;

  /** AWS secret access key for local development. */
  @Value("${aws.secretAccessKey}")
  private String secretAccessKey;

  /** Endpoint override, e.g. {@code http://localhost:8000}; blank for the regional endpoint. */
  @Value("${aws.dynamodb.endpoint:}")
  private String endpoint;

  @Bean
  StaticCredentialsProvider awsCreds() {
    return StaticCredentialsProvider.create(
        AwsBasicCredentials.create(accessKeyId, secretAccessKey));
  }

  /**
   * Creates an Amazon DynamoDB client using static credentials.
   *
   * @return a configured {@link DynamoDbClient} for the specified AWS region.
   */
  @Bean
  public DynamoDbClient dynamoDbClient(StaticCredentialsProvider creds) {
    DynamoDbClientBuilder builder =
        DynamoDbClient.builder().region(Region.of(region)).credentialsProvider(creds);
    if (endpoint != null && !endpoint.isBlank()) {
      builder.endpointOverride(URI.create(endpoint));
    }
    log.info(
        "aws.dynamodb region={} endpoint={}", region, endpoint.isBlank() ? "default" : endpoint);
    return builder.build();
  }

  @Bean
  public PaperStore paperStore(DynamoDbClient ddb, PaperIndexProperties props) {
    return new DynamoDbPaperStore(
        ddb,
        props.getTableName(),
        props.getProvision().getPollInterval(),
        props.getProvision().getMaxWait());
  }
}
