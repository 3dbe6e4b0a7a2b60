package com.socialpulse.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.socialpulse.api.entity.RunStatus;
import com.socialpulse.api.entity.Source;
import lombok.Builder;

import java.util.List;

@Builder
public record ScrapeCycleResult(
        Source source,
        @JsonProperty("items") int itemsFetched,
        @JsonProperty("new") int itemsNew,
        List<String> errors,
        double durationSeconds,
        RunStatus status
) {
}
