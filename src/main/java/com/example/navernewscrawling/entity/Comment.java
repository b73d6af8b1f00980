package com.example.navernewscrawling.entity;

import lombok.Builder;
import lombok.Getter;

import java.time.LocalDateTime;

/**
 * 댓글 정보
 *
 * comments.csv 한 행에 대응합니다.
 * 최상위 댓글은 parentCommentId가 null이고, 답글은 같은 기사의 최상위 댓글 ID를 가리킵니다.
 * articleId는 기사와 마찬가지로 커밋 단계에서 채워집니다.
 */
@Getter
@Builder(toBuilder = true)
public class Comment {

    private final Long articleId;

    /** 실행 전체에서 유일한 순차 ID */
    private final long commentId;

    private final Long parentCommentId;

    private final CommentType commentType;

    /** 사이트가 부여한 댓글 번호 (CSV에는 기록하지 않음) */
    private final String siteCommentId;

    private final String content;
    private final String author;
    private final long likeCount;
    private final long dislikeCount;

    /** 답글은 항상 0 */
    private final int replyCount;

    private final String createdAt;
    private final LocalDateTime scrapedAt;

    public boolean isReply() {
        return commentType == CommentType.REPLY;
    }
}
