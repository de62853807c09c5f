package com.golfdata.clubtracker.crawl.service;

public record RefreshTally(int selected, int updated, int unchanged, int errors, String lastError) {}
