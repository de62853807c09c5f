package com.golfdata.clubtracker.crawl.model;

public record Brand(long id, String name) {}
