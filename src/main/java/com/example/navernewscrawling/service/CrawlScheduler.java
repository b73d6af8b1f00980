package com.example.navernewscrawling.service;

import com.example.navernewscrawling.entity.CrawlStatus;
import com.example.navernewscrawling.writer.CrawlResultWriter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * 작업자 풀 스케줄러
 *
 * 고정 크기 스레드 풀에 URL을 배분하고, 성공한 기사는 완료되는 즉시 Writer로 넘깁니다.
 * 한 실행에 한 번만 사용합니다.
 */
@Slf4j
public class CrawlScheduler {

    private final ArticleWorker worker;
    private final CrawlResultWriter writer;
    private final CrawlProgressTracker tracker;
    private final int maxWorkers;

    /** 현재 기사를 처리 중인 작업자 스레드 (취소 시 인터럽트 대상) */
    private final Set<Thread> activeThreads = ConcurrentHashMap.newKeySet();

    private volatile boolean cancelled;

    public CrawlScheduler(ArticleWorker worker, CrawlResultWriter writer, CrawlProgressTracker tracker, int maxWorkers) {
        this.worker = worker;
        this.writer = writer;
        this.tracker = tracker;
        this.maxWorkers = maxWorkers;
    }

    /**
     * 모든 URL을 처리하고 결과를 입력 순서대로 반환합니다.
     * 성공한 기사는 반환 전에 이미 Writer 큐에 들어가 있습니다.
     */
    public List<ArticleOutcome> run(List<String> urls) {
        urls.forEach(url -> tracker.update(url, CrawlStatus.PENDING));
        log.info("{}개의 기사를 작업자 {}개로 처리합니다.", urls.size(), maxWorkers);

        ExecutorService pool = Executors.newFixedThreadPool(maxWorkers);
        List<CompletableFuture<ArticleOutcome>> futures = new ArrayList<>(urls.size());
        for (String url : urls) {
            futures.add(CompletableFuture.supplyAsync(() -> dispatch(url), pool));
        }

        // 모든 비동기 작업 완료 대기
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        pool.shutdown();
        try {
            if (!pool.awaitTermination(1, TimeUnit.MINUTES)) {
                log.warn("작업자 스레드 풀이 제시간에 종료되지 않았습니다.");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }

        List<ArticleOutcome> outcomes = new ArrayList<>(futures.size());
        futures.forEach(f -> outcomes.add(f.join()));
        return outcomes;
    }

    /**
     * 새 작업 배분을 멈추고, 처리 중인 작업자를 인터럽트합니다.
     * 대기 중이던 URL과 처리 중이던 URL은 cancelled 사유로 실패 처리됩니다.
     */
    public void cancel() {
        if (cancelled) {
            return;
        }
        cancelled = true;
        log.warn("크롤링 취소 요청. 처리 중인 작업자 {}개를 중단합니다.", activeThreads.size());
        activeThreads.forEach(Thread::interrupt);
    }

    public boolean isCancelled() {
        return cancelled;
    }

    private ArticleOutcome dispatch(String url) {
        Thread current = Thread.currentThread();
        activeThreads.add(current);
        try {
            if (cancelled) {
                return fail(ArticleOutcome.failed(url, ArticleOutcome.CANCELLED, 0));
            }
            log.info("처리 시작: {}", url);
            ArticleOutcome outcome = worker.process(url);
            if (!outcome.isCompleted()) {
                return fail(outcome);
            }
            if (!writer.submit(outcome.getArticle())) {
                return ArticleOutcome.failed(url, "출력 중단으로 기록되지 않음", outcome.getAttempts());
            }
            return outcome;
        } catch (RuntimeException e) {
            log.error("[실패] 작업 처리 예외: {}", url, e);
            return fail(ArticleOutcome.failed(url, e.toString(), 0));
        } finally {
            activeThreads.remove(current);
            // 풀 스레드를 재사용하므로 취소 인터럽트 표시를 지움
            Thread.interrupted();
        }
    }

    private ArticleOutcome fail(ArticleOutcome outcome) {
        tracker.update(outcome.getUrl(), CrawlStatus.FAILED);
        return outcome;
    }
}
