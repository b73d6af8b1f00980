package com.example.navernewscrawling.exception;

/**
 * 댓글 페이지 로드 실패. 댓글 단위가 아니라 기사 단위로 재시도합니다.
 */
public class PaginationException extends CrawlException {

    public PaginationException(String message) {
        super(message);
    }

    public PaginationException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
