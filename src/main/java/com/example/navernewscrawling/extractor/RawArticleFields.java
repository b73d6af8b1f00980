package com.example.navernewscrawling.extractor;

import lombok.Builder;
import lombok.Getter;

import java.math.BigDecimal;

/**
 * 페이지에서 추출한 기사 원시 필드. 모든 필드는 null 가능합니다.
 */
@Getter
@Builder
public class RawArticleFields {
    private final String title;
    private final String content;
    private final String author;
    private final String publishDate;
    private final String category;

    private final Long likeCount;
    private final Long commentCount;
    private final Long activeCommentCount;
    private final Long deletedCommentCount;
    private final Long removedCommentCount;

    private final BigDecimal maleRatio;
    private final BigDecimal femaleRatio;
    private final BigDecimal age10sRatio;
    private final BigDecimal age20sRatio;
    private final BigDecimal age30sRatio;
    private final BigDecimal age40sRatio;
    private final BigDecimal age50sRatio;
    private final BigDecimal age60plusRatio;
}
