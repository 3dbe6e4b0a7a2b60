package com.socialpulse.api.exception;

import com.socialpulse.api.entity.Source;
import lombok.Getter;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@Getter
@ResponseStatus(HttpStatus.CONFLICT)
public class ScrapeInProgressException extends RuntimeException {

    private final Source source;

    public ScrapeInProgressException(Source source) {
        super("Scrape already running for " + source.getKey());
        this.source = source;
    }
}
