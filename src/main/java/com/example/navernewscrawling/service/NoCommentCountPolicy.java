package com.example.navernewscrawling.service;

/**
 * 댓글 영역이 없는 기사의 comment_count 기록 방식
 */
public enum NoCommentCountPolicy {
    /** 0으로 기록 */
    ZERO,

    /** 빈 값으로 기록 */
    EMPTY
}
