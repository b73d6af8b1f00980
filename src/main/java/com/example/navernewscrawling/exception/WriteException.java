package com.example.navernewscrawling.exception;

/**
 * 출력 파일 I/O 실패
 *
 * 이후 출력의 무결성을 보장할 수 없으므로 실행 전체를 중단시킵니다.
 */
public class WriteException extends CrawlException {

    public WriteException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}
