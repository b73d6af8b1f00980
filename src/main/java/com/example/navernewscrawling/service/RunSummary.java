package com.example.navernewscrawling.service;

import com.example.navernewscrawling.entity.ArticleFailure;
import lombok.Builder;
import lombok.Getter;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;

/**
 * 실행 결과 요약
 */
@Getter
@Builder
public class RunSummary {

    private final LocalDateTime startedAt;
    private final Duration elapsed;

    /** 입력 URL 수 (중복 제거 후) */
    private final int totalUrls;
    private final int succeeded;
    private final int failed;
    private final int skipped;

    private final long commentsWritten;
    private final long dataQualityNotes;

    private final List<ArticleFailure> failures;

    /** 출력 I/O 오류로 중단된 경우 true */
    private final boolean aborted;
    private final String abortReason;

    private final String articlesFile;
    private final String commentsFile;
    /** 실패 URL 목록 파일 (실패가 없으면 null) */
    private final String failedUrlsFile;

    /**
     * 프로세스 종료 코드: 0 전체 성공, 1 일부 실패, 2 중단
     */
    public int exitCode() {
        if (aborted) {
            return 2;
        }
        return failed > 0 ? 1 : 0;
    }

    public static RunSummary abortedBeforeStart(String reason) {
        return RunSummary.builder()
                .startedAt(LocalDateTime.now())
                .elapsed(Duration.ZERO)
                .failures(List.of())
                .aborted(true)
                .abortReason(reason)
                .build();
    }
}
