package com.example.navernewscrawling.entity;

import lombok.Builder;
import lombok.Getter;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * 기사 정보
 *
 * articles.csv 한 행에 대응합니다.
 * 모든 추출 필드는 null 가능하며, null은 "값 없음"(빈 문자열로 기록)을 의미합니다.
 * 0과 null은 서로 다른 상태입니다.
 *
 * articleId는 작업자가 아니라 Writer의 커밋 단계에서 부여되므로
 * 작업자가 만든 인스턴스에서는 항상 null입니다.
 */
@Getter
@Builder(toBuilder = true)
public class Article {

    /** 커밋 시점에 부여되는 순차 ID */
    private final Long articleId;

    /** 원본 기사 URL (불변 식별자) */
    private final String url;

    private final String title;
    private final String content;
    private final String author;

    /** 발행일시 (yyyy-MM-dd HH:mm:ss로 정규화된 문자열, 파싱 불가 시 원문) */
    private final String publishDate;

    private final String category;

    private final Long likeCount;
    private final Long commentCount;
    private final Long activeCommentCount;
    private final Long deletedCommentCount;
    private final Long removedCommentCount;

    /** 성별/연령대 비율 (0.00 ~ 100.00, 합계 100 보장 없음) */
    private final BigDecimal maleRatio;
    private final BigDecimal femaleRatio;
    private final BigDecimal age10sRatio;
    private final BigDecimal age20sRatio;
    private final BigDecimal age30sRatio;
    private final BigDecimal age40sRatio;
    private final BigDecimal age50sRatio;
    private final BigDecimal age60plusRatio;

    /** 추출이 끝난 시각 */
    private final LocalDateTime scrapedAt;
}
