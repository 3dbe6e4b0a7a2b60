package com.socialpulse.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;

/**
 * Published once per finished cycle.
 */
@Builder
public record ScrapeCompletedEvent(
        String source,
        int items,
        @JsonProperty("new") int newItems,
        int errors
) {
}
