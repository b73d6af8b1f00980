package com.example.navernewscrawling.service;

import com.example.navernewscrawling.entity.ArticleFailure;
import com.example.navernewscrawling.entity.CompletedArticle;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * 작업자가 기사 한 건을 처리한 결과 (성공이면 Writer로 넘길 데이터, 실패면 사유)
 */
@Getter
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public class ArticleOutcome {

    public static final String CANCELLED = "cancelled";

    private final String url;
    private final CompletedArticle article;
    private final String failureReason;
    private final int attempts;

    public static ArticleOutcome completed(CompletedArticle article, int attempts) {
        return new ArticleOutcome(article.getUrl(), article, null, attempts);
    }

    public static ArticleOutcome failed(String url, String reason, int attempts) {
        return new ArticleOutcome(url, null, reason, attempts);
    }

    public boolean isCompleted() {
        return article != null;
    }

    public ArticleFailure toFailure() {
        return new ArticleFailure(url, failureReason, attempts);
    }
}
