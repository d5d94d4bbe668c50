package com.advisorscout.crawl.service;

import com.advisorscout.config.ScoutProperties;
import com.advisorscout.crawl.model.ScoutRunRequest;
import com.advisorscout.crawl.model.ScoutRunSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

@Component
public class ScoutCliRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(ScoutCliRunner.class);

    private final ScoutProperties properties;
    private final ScoutRunService runService;
    private final ConfigurableApplicationContext applicationContext;

    public ScoutCliRunner(
        ScoutProperties properties,
        ScoutRunService runService,
        ConfigurableApplicationContext applicationContext
    ) {
        this.properties = properties;
        this.runService = runService;
        this.applicationContext = applicationContext;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.getCli().isRun()) {
            return;
        }

        properties.validate();
        ScoutRunRequest request = new ScoutRunRequest(
            properties.getSitemap().getSeeds(),
            properties.getCli().getLimit(),
            properties.getFetch().getMaxWorkers(),
            properties.getFetch().delayRange(),
            Path.of(properties.getCli().getOutput())
        );

        ScoutRunSummary summary = runService.run(request);
        log.info(
            "Run finished with status {}: sitemaps={}, profileUrls={}, processed={}, profiles={}, empty={}, errors={}",
            summary.status(),
            summary.sitemapsVisited(),
            summary.profileUrlsDiscovered(),
            summary.profileUrlsProcessed(),
            summary.profilesExtracted(),
            summary.emptyProfiles(),
            summary.errors()
        );

        if (properties.getCli().isExitAfterRun()) {
            int status = summary.isCompleted() ? 0 : 1;
            int exitCode = SpringApplication.exit(applicationContext, () -> status);
            System.exit(exitCode);
        }
    }
}
