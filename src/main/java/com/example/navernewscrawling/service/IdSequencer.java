package com.example.navernewscrawling.service;

import java.util.concurrent.atomic.AtomicLong;

/**
 * 실행 단위 순차 ID 발급기
 *
 * 기사 ID와 댓글 ID는 각각 1부터 시작해 1씩 증가하며, 실행 중 재사용되지 않습니다.
 * 여러 작업자 스레드가 동시에 호출해도 안전합니다.
 * 재시도로 버려진 댓글 ID는 다시 발급하지 않으므로 출력에 간격이 생길 수 있습니다.
 */
public class IdSequencer {

    private final AtomicLong articleCounter;
    private final AtomicLong commentCounter;

    public IdSequencer() {
        this(0, 0);
    }

    private IdSequencer(long lastArticleId, long lastCommentId) {
        this.articleCounter = new AtomicLong(lastArticleId);
        this.commentCounter = new AtomicLong(lastCommentId);
    }

    /**
     * 이어쓰기 실행용. 기존 출력의 최대 ID 다음부터 발급합니다.
     */
    public static IdSequencer resumingAfter(long lastArticleId, long lastCommentId) {
        if (lastArticleId < 0 || lastCommentId < 0) {
            throw new IllegalArgumentException("ID는 음수일 수 없습니다");
        }
        return new IdSequencer(lastArticleId, lastCommentId);
    }

    public long nextArticleId() {
        return articleCounter.incrementAndGet();
    }

    public long nextCommentId() {
        return commentCounter.incrementAndGet();
    }

    public long lastArticleId() {
        return articleCounter.get();
    }

    public long lastCommentId() {
        return commentCounter.get();
    }
}
