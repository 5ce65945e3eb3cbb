package com.paperdex.app;

import com.paperdex.app.cli.CommandLineArgs;
import com.paperdex.app.config.PaperIndexProperties;
import lombok.extern.log4j.Log4j2;
import org.springframework.boot.Banner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Entry point for the paper index service.
 *
 * <p>Started without a command it serves the read API over HTTP. Started with a command it runs
 * that command once and exits with its status:
 *
 * <pre>
 *   java -jar paperdex-index-service.jar load papers.json
 *   java -jar paperdex-index-service.jar recent cs.LG --limit 5
 *   java -jar paperdex-index-service.jar --spring.profiles.active=local author "Jane Doe"
 * </pre>
 */
@Log4j2
@SpringBootApplication
@EnableConfigurationProperties(PaperIndexProperties.class)
public class PaperIndexServiceApplication {

  public static void main(String[] args) {
    SpringApplication app = new SpringApplication(PaperIndexServiceApplication.class);
    if (CommandLineArgs.hasCommand(args)) {
      app.setWebApplicationType(WebApplicationType.NONE);
      app.setBannerMode(Banner.Mode.OFF);
      System.exit(SpringApplication.exit(app.run(args)));
    }
    log.info("Starting paper index service...");
    app.run(args);
    log.info("Paper index service started.");
  }
}
