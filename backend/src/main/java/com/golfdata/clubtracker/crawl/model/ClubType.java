package com.golfdata.clubtracker.crawl.model;

public record ClubType(long id, String name) {}
