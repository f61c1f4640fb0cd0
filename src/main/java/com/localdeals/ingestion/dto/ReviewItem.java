package com.localdeals.ingestion.dto;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

@Getter
@Builder
@ToString
public class ReviewItem {

    private final String authorName;
    private final Integer rating;
    private final String text;

    /** Provider label such as "2 weeks ago". */
    private final String relativeTime;
}
