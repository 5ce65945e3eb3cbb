package com.paperdex.app.config;

import com.paperdex.app.repository.PaperStore;
import com.paperdex.app.repository.dynamodb.DynamoDbPaperStore;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;

/**
 * AWS configuration for the production profile.
 *
 * <p>Credentials come from the default provider chain (environment, profile, instance role). This
 * configuration is active only when the {@code production} Spring profile is enabled.
 */
@Configuration
@Profile("production")
public class AwsProdConfig {

  /**
   * AWS region in which the client will operate. Injected from the application configuration
   * property {@code aws.region}.
   */
  @Value("${aws.region}")
  private String region;

  /**
   * Creates an Amazon DynamoDB client using the default credentials provider.
   *
   * @return a configured {@link DynamoDbClient} for the specified AWS region.
   */
  @Bean
  public DynamoDbClient dynamoDbClient() {
    return DynamoDbClient.builder()
        .region(Region.of(region))
        .credentialsProvider(DefaultCredentialsProvider.create())
        .build();
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
