package com.example.navernewscrawling.exception;

/**
 * 크롤링 예외의 공통 부모
 *
 * 재시도 가능 여부에 따라 작업자의 재시도 정책이 달라집니다.
 */
public abstract class CrawlException extends RuntimeException {

    protected CrawlException(String message) {
        super(message);
    }

    protected CrawlException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * @return 같은 기사를 처음부터 다시 시도할 가치가 있으면 true
     */
    public abstract boolean isRetryable();
}
