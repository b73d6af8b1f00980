package com.example.navernewscrawling.config;

import com.example.navernewscrawling.service.NoCommentCountPolicy;
import com.example.navernewscrawling.service.OrphanReplyPolicy;
import jakarta.annotation.PostConstruct;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.convert.DurationUnit;

import java.nio.file.Path;
import java.time.Duration;
import java.time.temporal.ChronoUnit;

/**
 * 크롤러 설정 (application.properties의 crawler.* 항목)
 *
 * delay-between-requests와 timeout은 단위 없이 숫자만 주면 초 단위로 해석합니다.
 * 예: --crawler.delay-between-requests=3 --crawler.max-workers=4
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "crawler")
public class CrawlerProperties {

    /** 연속된 요청 시작 사이의 최소 간격 (전체 작업자 공통) */
    @DurationUnit(ChronoUnit.SECONDS)
    private Duration delayBetweenRequests = Duration.ofSeconds(3);

    /** 요청(페이지 로드) 타임아웃 */
    @DurationUnit(ChronoUnit.SECONDS)
    private Duration timeout = Duration.ofSeconds(30);

    /** 최초 시도 이후 추가 재시도 횟수 */
    private int retryCount = 3;

    /** 동시에 처리할 기사 수 */
    private int maxWorkers = 2;

    /** 재시도 대기 기본값 (시도마다 2배, retryBackoffMax로 제한) */
    private Duration retryBackoff = Duration.ofSeconds(2);

    private Duration retryBackoffMax = Duration.ofSeconds(30);

    /** 기사당 댓글 페이지 수 상한 (페이지네이션 무한 루프 방지) */
    private int maxCommentPages = 500;

    /** 기사당 댓글 페이지네이션 시간 상한 */
    private Duration commentPaginationTimeout = Duration.ofMinutes(10);

    private OrphanReplyPolicy orphanReplyPolicy = OrphanReplyPolicy.PROMOTE_TO_TOP_LEVEL;

    private NoCommentCountPolicy noCommentCountPolicy = NoCommentCountPolicy.ZERO;

    /** 댓글 로드 전에 클린봇(악성 댓글 숨김)을 끌지 여부. 켜져 있으면 숨겨진 댓글은 수집되지 않음 */
    private boolean disableCleanbot = true;

    private final Output output = new Output();

    /**
     * 출력 파일 설정
     */
    @Getter
    @Setter
    public static class Output {

        /** articles.csv, comments.csv가 생성될 디렉토리 */
        private Path dir = Path.of("output");

        /** true면 기존 출력 파일을 복구한 뒤 이어서 기록 (이미 기록된 URL은 건너뜀) */
        private boolean resume = true;
    }

    @PostConstruct
    void afterBind() {
        validate();
    }

    /**
     * 설정값 유효성 검사
     *
     * @throws IllegalArgumentException 범위를 벗어난 값이 있는 경우
     */
    public void validate() {
        if (delayBetweenRequests == null || delayBetweenRequests.isNegative()) {
            throw new IllegalArgumentException("delay-between-requests는 0 이상이어야 합니다: " + delayBetweenRequests);
        }
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout은 0보다 커야 합니다: " + timeout);
        }
        if (retryCount < 0) {
            throw new IllegalArgumentException("retry-count는 0 이상이어야 합니다: " + retryCount);
        }
        if (maxWorkers < 1) {
            throw new IllegalArgumentException("max-workers는 1 이상이어야 합니다: " + maxWorkers);
        }
        if (maxCommentPages < 1) {
            throw new IllegalArgumentException("max-comment-pages는 1 이상이어야 합니다: " + maxCommentPages);
        }
        if (retryBackoff.isNegative() || retryBackoffMax.isNegative()) {
            throw new IllegalArgumentException("retry-backoff 값은 음수일 수 없습니다");
        }
    }
}
