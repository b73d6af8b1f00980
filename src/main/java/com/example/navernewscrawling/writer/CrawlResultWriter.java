package com.example.navernewscrawling.writer;

import com.example.navernewscrawling.entity.Article;
import com.example.navernewscrawling.entity.ArticleFailure;
import com.example.navernewscrawling.entity.Comment;
import com.example.navernewscrawling.entity.CompletedArticle;
import com.example.navernewscrawling.entity.CrawlStatus;
import com.example.navernewscrawling.exception.WriteException;
import com.example.navernewscrawling.service.CrawlProgressTracker;
import com.example.navernewscrawling.service.IdSequencer;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 출력 파일 Writer (단일 스레드)
 *
 * 작업자들이 넘긴 기사를 큐에 받아 한 스레드에서 순서대로 기록합니다.
 * 기사 ID는 여기서 부여하므로 파일의 article_id는 기록 순서대로 증가합니다.
 *
 * 한 건의 기록 순서: 기사 ID 발급 → 댓글 행 → flush → 기사 행 → flush.
 * I/O 오류가 나면 이후 기록을 모두 중단하고 onFatalError를 호출합니다.
 */
@Slf4j
public class CrawlResultWriter implements AutoCloseable {

    /** 큐 종료 표시 */
    private static final CompletedArticle END_OF_QUEUE = new CompletedArticle(null, List.of(), List.of());

    private final CsvTables tables;
    private final IdSequencer sequencer;
    private final CrawlProgressTracker tracker;
    private final Runnable onFatalError;

    private final BlockingQueue<CompletedArticle> queue = new LinkedBlockingQueue<>();
    private final Thread writerThread;

    private final AtomicLong committedArticles = new AtomicLong();
    private final AtomicLong committedComments = new AtomicLong();
    private final AtomicLong committedNotes = new AtomicLong();
    private final List<ArticleFailure> abandoned = Collections.synchronizedList(new ArrayList<>());

    private volatile WriteException failure;
    private volatile boolean closed;

    CrawlResultWriter(CsvTables tables, IdSequencer sequencer, CrawlProgressTracker tracker, Runnable onFatalError) {
        this.tables = tables;
        this.sequencer = sequencer;
        this.tracker = tracker;
        this.onFatalError = onFatalError;
        this.writerThread = new Thread(this::drain, "csv-writer");
        this.writerThread.start();
    }

    /**
     * 출력 디렉토리의 articles.csv / comments.csv를 열고 Writer 스레드를 시작합니다.
     *
     * @param append 이어쓰기 여부 (false면 기존 파일을 비움)
     * @throws WriteException 파일을 열 수 없는 경우
     */
    public static CrawlResultWriter open(Path outputDir, boolean append, IdSequencer sequencer,
                                         CrawlProgressTracker tracker, Runnable onFatalError) {
        try {
            CsvTables tables = CsvTables.open(outputDir, append);
            log.info("출력 파일 열기: {} (이어쓰기={})", outputDir.toAbsolutePath(), append);
            return new CrawlResultWriter(tables, sequencer, tracker, onFatalError);
        } catch (IOException e) {
            throw new WriteException("출력 파일을 열 수 없습니다: " + outputDir.toAbsolutePath(), e);
        }
    }

    /**
     * 기록할 기사를 큐에 넣습니다. 호출 스레드를 막지 않습니다.
     *
     * @return 이미 치명적 오류가 났거나 닫힌 경우 false (호출자가 실패로 처리)
     */
    public boolean submit(CompletedArticle unit) {
        if (failure != null || closed) {
            tracker.update(unit.getUrl(), CrawlStatus.FAILED);
            return false;
        }
        queue.add(unit);
        return true;
    }

    private void drain() {
        while (true) {
            CompletedArticle unit;
            try {
                unit = queue.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Writer 스레드 인터럽트, 남은 {}건은 기록되지 않습니다", queue.size());
                queue.forEach(this::abandonIfUnit);
                return;
            }
            if (unit == END_OF_QUEUE) {
                return;
            }
            if (failure != null) {
                abandon(unit);
                continue;
            }
            try {
                commit(unit);
            } catch (IOException e) {
                failure = new WriteException("출력 파일 기록 실패 (" + unit.getUrl() + ")", e);
                log.error("출력 파일 기록 중 오류 발생. 실행을 중단합니다.", e);
                abandon(unit);
                onFatalError.run();
            }
        }
    }

    private void commit(CompletedArticle unit) throws IOException {
        long articleId = sequencer.nextArticleId();
        Article article = unit.getArticle().toBuilder().articleId(articleId).build();
        List<Comment> comments = new ArrayList<>(unit.getComments().size());
        for (Comment comment : unit.getComments()) {
            comments.add(comment.toBuilder().articleId(articleId).build());
        }

        tables.writeUnit(article, comments);

        committedArticles.incrementAndGet();
        committedComments.addAndGet(comments.size());
        committedNotes.addAndGet(unit.getNotes().size());
        tracker.update(unit.getUrl(), CrawlStatus.COMPLETED);
        log.info("[저장] article_id={} {} (댓글 {}개)", articleId, unit.getUrl(), comments.size());
    }

    private void abandonIfUnit(CompletedArticle unit) {
        if (unit != END_OF_QUEUE) {
            abandon(unit);
        }
    }

    private void abandon(CompletedArticle unit) {
        abandoned.add(new ArticleFailure(unit.getUrl(), "출력 중단으로 기록되지 않음", 0));
        tracker.update(unit.getUrl(), CrawlStatus.FAILED);
    }

    public long getCommittedArticles() {
        return committedArticles.get();
    }

    public long getCommittedComments() {
        return committedComments.get();
    }

    public long getCommittedNotes() {
        return committedNotes.get();
    }

    /**
     * 큐에 들어갔지만 출력 중단으로 기록되지 못한 기사
     */
    public List<ArticleFailure> getAbandoned() {
        synchronized (abandoned) {
            return List.copyOf(abandoned);
        }
    }

    /**
     * @return 치명적 I/O 오류가 있었으면 그 예외, 없으면 null
     */
    public WriteException getFailure() {
        return failure;
    }

    /**
     * 큐에 남은 기사를 모두 기록한 뒤 파일을 닫습니다.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        queue.add(END_OF_QUEUE);
        try {
            writerThread.join();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Writer 종료 대기 중 인터럽트");
        }
        try {
            tables.close();
        } catch (IOException e) {
            if (failure == null) {
                failure = new WriteException("출력 파일 닫기 실패", e);
            }
            log.error("출력 파일 닫기 실패", e);
        }
    }
}
