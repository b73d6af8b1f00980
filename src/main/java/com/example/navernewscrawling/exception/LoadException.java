package com.example.navernewscrawling.exception;

/**
 * 페이지 이동/로드 실패 (네트워크, 페이지 로드 타임아웃 등). 재시도 대상입니다.
 */
public class LoadException extends CrawlException {

    public LoadException(String message) {
        super(message);
    }

    public LoadException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
