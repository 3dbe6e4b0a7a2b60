package com.socialpulse.api.dto;

import com.socialpulse.api.entity.Source;
import com.socialpulse.api.entity.TrendingTopic;
import lombok.Builder;

import java.time.LocalDateTime;

@Builder
public record TrendDto(
        Long id,
        Source source,
        String topic,
        int mentionCount,
        double avgEngagement,
        LocalDateTime firstSeen,
        LocalDateTime lastSeen
) {

    public static TrendDto from(TrendingTopic topic) {
        return TrendDto.builder()
                .id(topic.getId())
                .source(topic.getSource())
                .topic(topic.getTopic())
                .mentionCount(topic.getMentionCount())
                .avgEngagement(topic.getAvgEngagement())
                .firstSeen(topic.getFirstSeen())
                .lastSeen(topic.getLastSeen())
                .build();
    }
}
