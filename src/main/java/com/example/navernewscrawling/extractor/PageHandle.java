package com.example.navernewscrawling.extractor;

/**
 * 로드된 기사 페이지 (브라우저 세션 등 구현체 자원 포함)
 */
public interface PageHandle extends AutoCloseable {

    String url();

    /**
     * 세션 자원을 해제합니다. 예외를 던지지 않습니다.
     */
    @Override
    void close();
}
