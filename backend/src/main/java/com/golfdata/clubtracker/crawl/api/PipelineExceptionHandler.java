package com.golfdata.clubtracker.crawl.api;

import com.golfdata.clubtracker.crawl.service.ActiveScrapeRunException;
import com.golfdata.clubtracker.crawl.source.UnknownSourceException;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class PipelineExceptionHandler {

  @ExceptionHandler(ActiveScrapeRunException.class)
  public ResponseEntity<Map<String, String>> handleActiveRun(ActiveScrapeRunException ex) {
    return ResponseEntity.status(HttpStatus.CONFLICT)
        .body(Map.of("error", "active_scrape_run", "message", ex.getMessage()));
  }

  @ExceptionHandler(UnknownSourceException.class)
  public ResponseEntity<Map<String, String>> handleUnknownSource(UnknownSourceException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(Map.of("error", "unknown_source", "message", ex.getMessage()));
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<Map<String, String>> handleBadRequest(IllegalArgumentException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(Map.of("error", "bad_request", "message", String.valueOf(ex.getMessage())));
  }
}
