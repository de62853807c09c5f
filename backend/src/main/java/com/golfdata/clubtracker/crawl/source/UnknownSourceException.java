package com.golfdata.clubtracker.crawl.source;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.BAD_REQUEST)
public class UnknownSourceException extends RuntimeException {
    public UnknownSourceException(String message) {
        super(message);
    }
}
