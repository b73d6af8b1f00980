package com.example.navernewscrawling.entity;

/**
 * 기사 한 건의 처리 상태
 *
 * 전체 흐름:
 * PENDING → IN_PROGRESS → COMPLETED
 *                ↓    ↑
 *             RETRYING
 *                ↓
 *              FAILED (재시도 소진 시)
 *
 * SKIPPED는 이어쓰기 실행에서 이미 출력 파일에 기록된 URL입니다.
 */
public enum CrawlStatus {
    /** 대기열에 등록됨 */
    PENDING,

    /** 작업자가 처리 중 */
    IN_PROGRESS,

    /** 일시적 오류 후 재시도 대기 (백오프 중) */
    RETRYING,

    /** 기사 + 댓글이 출력 파일에 기록됨 (최종 성공 상태) */
    COMPLETED,

    /** 재시도 소진 또는 복구 불가 오류 (최종 실패 상태) */
    FAILED,

    /** 이전 실행에서 이미 기록되어 건너뜀 */
    SKIPPED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == SKIPPED;
    }
}
