package com.golfdata.clubtracker.crawl.service;

import com.golfdata.clubtracker.config.PipelineProperties;
import com.golfdata.clubtracker.crawl.model.FullCrawlRequest;
import com.golfdata.clubtracker.crawl.model.PipelineRunSummary;
import com.golfdata.clubtracker.crawl.model.ScrapeRunStatus;
import com.golfdata.clubtracker.crawl.source.SourceAdapter;
import com.golfdata.clubtracker.crawl.source.SourceAdapterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
@Order(10)
public class PipelineCliRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(PipelineCliRunner.class);
    static final String MODE_FULL = "full";
    static final String MODE_REFRESH = "refresh";

    private final PipelineProperties properties;
    private final SourceAdapterRegistry registry;
    private final CatalogPipelineService pipelineService;
    private final ConfigurableApplicationContext applicationContext;

    public PipelineCliRunner(
        PipelineProperties properties,
        SourceAdapterRegistry registry,
        CatalogPipelineService pipelineService,
        ConfigurableApplicationContext applicationContext
    ) {
        this.properties = properties;
        this.registry = registry;
        this.pipelineService = pipelineService;
        this.applicationContext = applicationContext;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.getCli().isRun()) {
            return;
        }
        List<PipelineRunSummary> summaries = runConfigured();
        boolean anyFailed = summaries.stream().anyMatch(s -> s.status() == ScrapeRunStatus.FAILED);

        if (properties.getCli().isExitAfterRun()) {
            int exitCode = SpringApplication.exit(applicationContext, () -> anyFailed ? 1 : 0);
            System.exit(exitCode);
        }
    }

    List<PipelineRunSummary> runConfigured() {
        PipelineProperties.Cli cli = properties.getCli();
        String mode = cli.getMode();
        if (!MODE_FULL.equals(mode) && !MODE_REFRESH.equals(mode)) {
            throw new IllegalArgumentException("Unsupported pipeline.cli.mode: " + mode);
        }
        List<PipelineRunSummary> summaries = new ArrayList<>();
        for (SourceAdapter adapter : registry.resolve(cli.getSource())) {
            PipelineRunSummary summary;
            try {
                summary = MODE_REFRESH.equals(mode)
                    ? pipelineService.runRefresh(adapter.key(), cli.getBatchSize())
                    : pipelineService.runFullCrawl(
                        new FullCrawlRequest(adapter.key(), cli.getCategory(), cli.getBrand(), null)
                    );
            } catch (ActiveScrapeRunException e) {
                log.warn("Skipping {}: {}", adapter.key(), e.getMessage());
                continue;
            }
            log.info(
                "Run {} {} {} finished {}: added={}, updated={}, errors={}, skipped={}",
                summary.runId(),
                summary.sourceName(),
                summary.scrapeType(),
                summary.status().dbValue(),
                summary.recordsAdded(),
                summary.recordsUpdated(),
                summary.errors(),
                summary.skipped()
            );
            summaries.add(summary);
        }
        return summaries;
    }
}
