package com.golfdata.clubtracker.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.golfdata.clubtracker.crawl.http.RequestRateLimiter;
import com.golfdata.clubtracker.crawl.http.SlidingWindowRateLimiter;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class PipelineConfig {

    @Bean(name = "httpExecutor", destroyMethod = "shutdown")
    public ExecutorService httpExecutor(PipelineProperties properties) {
        int size = Math.max(2, properties.getFetch().getHttpThreads());
        return Executors.newFixedThreadPool(size);
    }

    @Bean
    public RequestRateLimiter requestRateLimiter(PipelineProperties properties) {
        PipelineProperties.Fetch fetch = properties.getFetch();
        return new SlidingWindowRateLimiter(
            fetch.getRequestsPerWindow(),
            Duration.ofMillis(fetch.getRateWindowMs())
        );
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }
}
