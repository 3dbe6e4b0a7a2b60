package com.socialpulse.api.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

import java.util.List;

@Getter
@AllArgsConstructor
@Builder
public class PostPageDto {

    private final List<PostDto> content;
    private final long total;
    private final int page;
    private final int size;

    public static PostPageDto of(List<PostDto> content, long total, int page, int size) {
        return PostPageDto.builder()
                .content(content)
                .total(total)
                .page(page)
                .size(size)
                .build();
    }
}
