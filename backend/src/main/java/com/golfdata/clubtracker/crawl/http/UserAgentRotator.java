package com.golfdata.clubtracker.crawl.http;

import com.golfdata.clubtracker.config.PipelineProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.ThreadLocalRandom;

@Component
public class UserAgentRotator {
    private final List<String> userAgents;

    @Autowired
    public UserAgentRotator(PipelineProperties properties) {
        this(properties.getFetch().getUserAgents());
    }

    public UserAgentRotator(List<String> userAgents) {
        List<String> safe = userAgents == null
            ? List.of()
            : userAgents.stream().map(PipelineProperties::normalizeUserAgent).distinct().toList();
        this.userAgents = safe.isEmpty() ? List.of(PipelineProperties.normalizeUserAgent(null)) : safe;
    }

    public String next() {
        if (userAgents.size() == 1) {
            return userAgents.get(0);
        }
        return userAgents.get(ThreadLocalRandom.current().nextInt(userAgents.size()));
    }
}
