package com.golfdata.clubtracker.crawl.api;

import com.golfdata.clubtracker.crawl.model.CatalogStatusResponse;
import com.golfdata.clubtracker.crawl.model.FullCrawlRequest;
import com.golfdata.clubtracker.crawl.model.PipelineRunSummary;
import com.golfdata.clubtracker.crawl.model.ScrapeRun;
import com.golfdata.clubtracker.crawl.service.CatalogPipelineService;
import com.golfdata.clubtracker.crawl.service.CatalogStatusService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api")
public class PipelineController {
    private final CatalogPipelineService pipelineService;
    private final CatalogStatusService statusService;

    public PipelineController(CatalogPipelineService pipelineService, CatalogStatusService statusService) {
        this.pipelineService = pipelineService;
        this.statusService = statusService;
    }

    @PostMapping("/crawl/full")
    public PipelineRunSummary runFullCrawl(@RequestBody(required = false) FullCrawlRequest request) {
        return pipelineService.runFullCrawl(request);
    }

    @PostMapping("/crawl/refresh")
    public PipelineRunSummary runRefresh(
        @RequestParam(name = "source", required = false) String source,
        @RequestParam(name = "batchSize", required = false) Integer batchSize
    ) {
        return pipelineService.runRefresh(source, batchSize);
    }

    @GetMapping("/runs")
    public List<ScrapeRun> recentRuns(
        @RequestParam(name = "source", required = false) String source,
        @RequestParam(name = "limit", required = false) Integer limit
    ) {
        return statusService.getRecentRuns(source, limit);
    }

    @GetMapping("/runs/{runId}")
    public ScrapeRun run(@PathVariable("runId") long runId) {
        return statusService.getRun(runId);
    }

    @GetMapping("/status")
    public CatalogStatusResponse status() {
        return statusService.getStatus();
    }
}
