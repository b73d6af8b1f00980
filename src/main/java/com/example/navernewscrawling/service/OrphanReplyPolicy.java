package com.example.navernewscrawling.service;

/**
 * 부모 댓글을 찾을 수 없는 답글(고아 답글) 처리 방식
 */
public enum OrphanReplyPolicy {
    /** 최상위 댓글로 기록 */
    PROMOTE_TO_TOP_LEVEL,

    /** 기록하지 않음 */
    DROP
}
