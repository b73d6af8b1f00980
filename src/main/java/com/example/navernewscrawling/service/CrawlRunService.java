package com.example.navernewscrawling.service;

import com.example.navernewscrawling.config.CrawlerProperties;
import com.example.navernewscrawling.entity.ArticleFailure;
import com.example.navernewscrawling.entity.CrawlStatus;
import com.example.navernewscrawling.exception.WriteException;
import com.example.navernewscrawling.extractor.ArticleExtractor;
import com.example.navernewscrawling.util.DateTimes;
import com.example.navernewscrawling.writer.CrawlResultWriter;
import com.example.navernewscrawling.writer.CsvTables;
import com.example.navernewscrawling.writer.OutputRecovery;
import com.example.navernewscrawling.writer.RecoveredOutput;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FileUtils;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 크롤링 실행 서비스
 *
 * URL 목록 한 번의 실행을 처음부터 끝까지 조율합니다.
 *
 * 주요 흐름:
 * 1. 기존 출력 복구 (이어쓰기 모드): 이미 기록된 URL은 SKIPPED
 * 2. Writer 시작 (기사 ID는 기존 최대값 다음부터)
 * 3. 작업자 풀로 기사 처리, 성공한 기사는 즉시 Writer로 전달
 * 4. Writer 종료 후 실패 URL 파일 작성, 요약 반환
 *
 * 동시에 하나의 실행만 허용합니다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CrawlRunService {

    private static final DateTimeFormatter FILE_TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final ArticleExtractor extractor;
    private final CrawlerProperties properties;
    private final CrawlProgressTracker tracker;
    private final Clock clock;

    private final AtomicBoolean running = new AtomicBoolean(false);

    private volatile CrawlScheduler activeScheduler;
    private volatile boolean cancelRequested;
    private volatile RunSummary lastSummary;

    /**
     * URL 목록을 처리합니다. 실행이 끝날 때까지 반환하지 않습니다.
     *
     * @param urls      처리할 URL (중복 제거된 목록)
     * @param outputDir 출력 디렉토리
     * @throws IllegalStateException 이미 실행 중인 경우
     */
    public RunSummary run(List<String> urls, Path outputDir) {
        if (!running.compareAndSet(false, true)) {
            throw new IllegalStateException("이미 크롤링이 실행 중입니다.");
        }
        try {
            RunSummary summary = execute(urls, outputDir);
            lastSummary = summary;
            return summary;
        } finally {
            running.set(false);
        }
    }

    /**
     * 별도 스레드에서 실행을 시작합니다. (REST API용)
     *
     * @return 이미 실행 중이면 false
     */
    public boolean startAsync(List<String> urls, Path outputDir) {
        if (!running.compareAndSet(false, true)) {
            return false;
        }
        new Thread(() -> {
            try {
                lastSummary = execute(urls, outputDir);
            } catch (RuntimeException e) {
                log.error("크롤링 실행 중 예외 발생", e);
                lastSummary = RunSummary.abortedBeforeStart(e.toString());
            } finally {
                running.set(false);
            }
        }, "crawl-run").start();
        return true;
    }

    /**
     * 실행 중인 작업을 취소합니다. 처리 중이던 기사는 기록되지 않고 실패로 남습니다.
     */
    public void cancel() {
        cancelRequested = true;
        CrawlScheduler scheduler = activeScheduler;
        if (scheduler != null) {
            scheduler.cancel();
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * 실행이 끝날 때까지 대기합니다.
     *
     * @return 제한 시간 안에 끝났으면 true
     */
    public boolean awaitIdle(Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (running.get()) {
            if (System.nanoTime() > deadline) {
                return false;
            }
            Thread.sleep(200);
        }
        return true;
    }

    public Optional<RunSummary> getLastSummary() {
        return Optional.ofNullable(lastSummary);
    }

    /**
     * 작업 현황 조회 (상태별 URL 개수)
     */
    public Map<String, Long> getCrawlStatus() {
        return tracker.counts();
    }

    private RunSummary execute(List<String> urls, Path outputDir) {
        LocalDateTime startedAt = LocalDateTime.now(clock);
        long startNanos = System.nanoTime();
        cancelRequested = false;
        tracker.reset();

        boolean append = properties.getOutput().isResume();
        RecoveredOutput recovered;
        try {
            recovered = append ? OutputRecovery.recover(outputDir) : RecoveredOutput.empty();
        } catch (IOException e) {
            log.error("기존 출력 파일을 읽을 수 없습니다: {}", outputDir.toAbsolutePath(), e);
            return RunSummary.abortedBeforeStart("출력 파일 복구 실패: " + e.getMessage());
        }

        List<String> pending = new ArrayList<>(urls.size());
        int skipped = 0;
        for (String url : urls) {
            if (recovered.getWrittenUrls().contains(url)) {
                tracker.update(url, CrawlStatus.SKIPPED);
                skipped++;
            } else {
                pending.add(url);
            }
        }
        if (skipped > 0) {
            log.info("이미 기록된 URL {}개를 건너뜁니다.", skipped);
        }

        IdSequencer sequencer = IdSequencer.resumingAfter(recovered.getLastArticleId(), recovered.getLastCommentId());
        CrawlResultWriter writer;
        try {
            writer = CrawlResultWriter.open(outputDir, append, sequencer, tracker, this::cancel);
        } catch (WriteException e) {
            log.error(e.getMessage(), e);
            return RunSummary.abortedBeforeStart(e.getMessage());
        }

        ArticleWorker worker = new ArticleWorker(extractor, sequencer,
                new PolitenessGate(properties.getDelayBetweenRequests()), RetryPolicy.from(properties),
                properties, tracker, clock);
        CrawlScheduler scheduler = new CrawlScheduler(worker, writer, tracker, properties.getMaxWorkers());

        List<ArticleOutcome> outcomes;
        activeScheduler = scheduler;
        try {
            if (cancelRequested) {
                scheduler.cancel();
            }
            outcomes = scheduler.run(pending);
        } finally {
            activeScheduler = null;
            writer.close();
        }

        List<ArticleFailure> failures = new ArrayList<>();
        outcomes.stream()
                .filter(outcome -> !outcome.isCompleted())
                .map(ArticleOutcome::toFailure)
                .forEach(failures::add);
        failures.addAll(writer.getAbandoned());

        WriteException writeFailure = writer.getFailure();
        RunSummary summary = RunSummary.builder()
                .startedAt(startedAt)
                .elapsed(Duration.ofNanos(System.nanoTime() - startNanos))
                .totalUrls(urls.size())
                .succeeded((int) writer.getCommittedArticles())
                .failed(failures.size())
                .skipped(skipped)
                .commentsWritten(writer.getCommittedComments())
                .dataQualityNotes(writer.getCommittedNotes())
                .failures(List.copyOf(failures))
                .aborted(writeFailure != null)
                .abortReason(writeFailure == null ? null : writeFailure.getMessage())
                .articlesFile(outputDir.resolve(CsvTables.ARTICLES_FILE).toString())
                .commentsFile(outputDir.resolve(CsvTables.COMMENTS_FILE).toString())
                .failedUrlsFile(writeFailedUrls(outputDir, failures, startedAt))
                .build();
        logSummary(summary);
        return summary;
    }

    /**
     * 실패 URL 목록 파일 작성 (그대로 다음 실행의 URL 파일로 사용 가능)
     *
     * @return 파일 경로, 실패가 없거나 작성하지 못하면 null
     */
    private String writeFailedUrls(Path outputDir, List<ArticleFailure> failures, LocalDateTime startedAt) {
        if (failures.isEmpty()) {
            return null;
        }
        Path file = outputDir.resolve("failed_urls_" + startedAt.format(FILE_TIMESTAMP) + ".txt");
        List<String> lines = new ArrayList<>();
        lines.add("# 실패한 URL 목록 (" + DateTimes.format(startedAt) + " 실행, " + failures.size() + "개)");
        for (ArticleFailure failure : failures) {
            lines.add("# " + failure.getReason() + " (시도 " + failure.getAttempts() + "회)");
            lines.add(failure.getUrl());
        }
        try {
            FileUtils.writeLines(file.toFile(), StandardCharsets.UTF_8.name(), lines);
            log.info("실패 URL 목록 저장: {}", file.toAbsolutePath());
            return file.toString();
        } catch (IOException e) {
            log.error("실패 URL 목록 저장 실패: {}", file.toAbsolutePath(), e);
            return null;
        }
    }

    private void logSummary(RunSummary summary) {
        log.info("========== 크롤링 {} ==========", summary.isAborted() ? "중단" : "완료");
        log.info("├─ 전체 URL: {}개 (건너뜀 {}개)", summary.getTotalUrls(), summary.getSkipped());
        log.info("├─ 성공: {}개, 실패: {}개", summary.getSucceeded(), summary.getFailed());
        log.info("├─ 저장된 댓글: {}개, 데이터 품질 노트: {}개", summary.getCommentsWritten(), summary.getDataQualityNotes());
        log.info("├─ 소요 시간: {}초", summary.getElapsed().toSeconds());
        for (ArticleFailure failure : summary.getFailures()) {
            log.info("│  ✗ {} - {}", failure.getUrl(), failure.getReason());
        }
        if (summary.isAborted()) {
            log.error("└─ 중단 사유: {}", summary.getAbortReason());
        } else {
            log.info("└─ 출력: {}, {}", summary.getArticlesFile(), summary.getCommentsFile());
        }
    }
}
