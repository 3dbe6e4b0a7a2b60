package com.socialpulse.api.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.SERVICE_UNAVAILABLE)
public class SubscriberLimitExceededException extends RuntimeException {

    public SubscriberLimitExceededException(int capacity) {
        super("Subscriber limit reached (" + capacity + ")");
    }
}
