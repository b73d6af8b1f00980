package com.example.navernewscrawling.service;

import com.example.navernewscrawling.config.CrawlerProperties;
import com.example.navernewscrawling.entity.Article;
import com.example.navernewscrawling.entity.Comment;
import com.example.navernewscrawling.entity.CompletedArticle;
import com.example.navernewscrawling.entity.CrawlStatus;
import com.example.navernewscrawling.entity.DataQualityNote;
import com.example.navernewscrawling.exception.CrawlException;
import com.example.navernewscrawling.extractor.ArticleExtractor;
import com.example.navernewscrawling.extractor.CommentCursor;
import com.example.navernewscrawling.extractor.CommentPage;
import com.example.navernewscrawling.extractor.PageHandle;
import com.example.navernewscrawling.extractor.RawArticleFields;
import com.example.navernewscrawling.util.DateTimes;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * 기사 한 건 처리 작업자
 *
 * 페이지 로드 → 메타데이터 추출 → 댓글 페이지네이션 → 트리 구성까지를 하나의 단위로 수행합니다.
 * 일시적 오류가 나면 부분 결과를 모두 버리고 기사 처음부터 다시 시도하므로,
 * 성공한 결과는 재시도 횟수와 무관하게 같은 모양을 가집니다.
 *
 * 결과는 출력 파일에 쓰지 않고 {@link ArticleOutcome}으로 반환합니다.
 */
@Slf4j
@RequiredArgsConstructor
public class ArticleWorker {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final ArticleExtractor extractor;
    private final IdSequencer sequencer;
    private final PolitenessGate politenessGate;
    private final RetryPolicy retryPolicy;
    private final CrawlerProperties properties;
    private final CrawlProgressTracker tracker;
    private final Clock clock;

    /**
     * 기사 한 건을 처리합니다. 예외를 던지지 않습니다.
     *
     * @param url 기사 URL
     * @return 성공 시 기사/댓글 데이터, 실패 시 사유와 시도 횟수
     */
    public ArticleOutcome process(String url) {
        int attempt = 0;
        while (true) {
            attempt++;
            tracker.update(url, CrawlStatus.IN_PROGRESS);
            try {
                CompletedArticle result = extractOnce(url);
                log.info("[성공] {} (댓글 {}개, 시도 {}회)", url, result.getComments().size(), attempt);
                return ArticleOutcome.completed(result, attempt);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.info("[취소] {}", url);
                return ArticleOutcome.failed(url, ArticleOutcome.CANCELLED, attempt);
            } catch (CrawlException e) {
                if (!e.isRetryable() || !retryPolicy.hasAttemptsLeft(attempt)) {
                    log.error("[실패] {} ({}회 시도): {}", url, attempt, e.getMessage());
                    return ArticleOutcome.failed(url, e.getMessage(), attempt);
                }
                log.warn("[재시도] {} ({}/{}): {}", url, attempt, retryPolicy.maxAttempts(), e.getMessage());
                tracker.update(url, CrawlStatus.RETRYING);
                try {
                    retryPolicy.sleepBeforeRetry(attempt);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    return ArticleOutcome.failed(url, ArticleOutcome.CANCELLED, attempt);
                }
            } catch (RuntimeException e) {
                // 분류되지 않은 오류는 재시도해도 같은 결과이므로 바로 실패 처리
                log.error("[실패] {} 예상하지 못한 오류", url, e);
                return ArticleOutcome.failed(url, e.getClass().getSimpleName() + ": " + e.getMessage(), attempt);
            }
        }
    }

    /**
     * 한 번의 시도. 실패하면 부분 결과는 버려집니다.
     */
    private CompletedArticle extractOnce(String url) throws InterruptedException {
        politenessGate.acquire();
        try (PageHandle page = extractor.load(url)) {
            RawArticleFields raw = extractor.extractMetadata(page);
            List<DataQualityNote> notes = new ArrayList<>();

            boolean commentSection = extractor.hasComments(page);
            List<Comment> comments;
            if (!commentSection) {
                log.debug("댓글 영역 없음: {}", url);
                comments = List.of();
            } else if (raw.getCommentCount() != null && raw.getCommentCount() == 0) {
                log.debug("댓글 수 0, 페이지네이션 생략: {}", url);
                comments = List.of();
            } else {
                comments = collectComments(page, notes);
            }

            Article article = assemble(url, raw, commentSection, notes);
            notes.forEach(note -> log.warn("데이터 품질: {}", note));
            return new CompletedArticle(article, comments, notes);
        }
    }

    /**
     * 댓글 페이지를 끝까지 넘기며 트리를 만듭니다.
     *
     * 종료 조건: 다음 커서 없음, 처음 보는 레코드 0건, 페이지 수 상한, 시간 상한.
     * 번호 없는 레코드나 제외된 답글만 있는 페이지도 처음 보는 레코드로 셉니다.
     * 상한에 걸린 경우 지금까지 받은 댓글로 성공 처리하고 노트를 남깁니다.
     */
    private List<Comment> collectComments(PageHandle page, List<DataQualityNote> notes) throws InterruptedException {
        String url = page.url();
        CommentTreeBuilder builder = new CommentTreeBuilder(url, sequencer, properties.getOrphanReplyPolicy());
        Instant deadline = clock.instant().plus(properties.getCommentPaginationTimeout());
        CommentCursor cursor = CommentCursor.first();
        int pages = 0;

        while (true) {
            if (pages >= properties.getMaxCommentPages()) {
                notes.add(new DataQualityNote(url, DataQualityNote.Kind.PAGINATION_CEILING,
                        "댓글 페이지 상한 " + properties.getMaxCommentPages() + "페이지 도달, " + builder.size() + "개까지만 수집"));
                break;
            }
            if (clock.instant().isAfter(deadline)) {
                notes.add(new DataQualityNote(url, DataQualityNote.Kind.PAGINATION_CEILING,
                        "댓글 수집 시간 상한 " + properties.getCommentPaginationTimeout() + " 초과, " + builder.size() + "개까지만 수집"));
                break;
            }

            politenessGate.acquire();
            CommentPage commentPage = extractor.fetchCommentPage(page, cursor);
            pages++;
            int fresh = builder.accept(commentPage.getRecords(), LocalDateTime.now(clock));
            log.debug("댓글 페이지 {}: 새 레코드 {}개 (누적 {}개)", cursor.getPageIndex(), fresh, builder.size());

            if (commentPage.isLast() || fresh == 0) {
                break;
            }
            cursor = commentPage.nextCursor().orElseThrow();
        }

        if (builder.duplicatesSkipped() > 0) {
            log.debug("중복 댓글 레코드 {}개 제외: {}", builder.duplicatesSkipped(), url);
        }
        notes.addAll(builder.notes());
        return builder.build();
    }

    private Article assemble(String url, RawArticleFields raw, boolean commentSection, List<DataQualityNote> notes) {
        if (raw.getTitle() == null) {
            notes.add(new DataQualityNote(url, DataQualityNote.Kind.FIELD_MISSING, "title"));
        }
        if (raw.getContent() == null) {
            notes.add(new DataQualityNote(url, DataQualityNote.Kind.FIELD_MISSING, "content"));
        }

        Long commentCount = raw.getCommentCount();
        if (!commentSection && commentCount == null && properties.getNoCommentCountPolicy() == NoCommentCountPolicy.ZERO) {
            commentCount = 0L;
        }

        return Article.builder()
                .url(url)
                .title(raw.getTitle())
                .content(raw.getContent())
                .author(raw.getAuthor())
                .publishDate(DateTimes.normalize(raw.getPublishDate()))
                .category(raw.getCategory())
                .likeCount(raw.getLikeCount())
                .commentCount(commentCount)
                .activeCommentCount(raw.getActiveCommentCount())
                .deletedCommentCount(raw.getDeletedCommentCount())
                .removedCommentCount(raw.getRemovedCommentCount())
                .maleRatio(ratio(url, "male_ratio", raw.getMaleRatio(), notes))
                .femaleRatio(ratio(url, "female_ratio", raw.getFemaleRatio(), notes))
                .age10sRatio(ratio(url, "age_10s_ratio", raw.getAge10sRatio(), notes))
                .age20sRatio(ratio(url, "age_20s_ratio", raw.getAge20sRatio(), notes))
                .age30sRatio(ratio(url, "age_30s_ratio", raw.getAge30sRatio(), notes))
                .age40sRatio(ratio(url, "age_40s_ratio", raw.getAge40sRatio(), notes))
                .age50sRatio(ratio(url, "age_50s_ratio", raw.getAge50sRatio(), notes))
                .age60plusRatio(ratio(url, "age_60plus_ratio", raw.getAge60plusRatio(), notes))
                .scrapedAt(LocalDateTime.now(clock))
                .build();
    }

    /**
     * 0 ~ 100 범위를 벗어난 비율은 기록하지 않고 노트를 남깁니다.
     */
    private static BigDecimal ratio(String url, String field, BigDecimal value, List<DataQualityNote> notes) {
        if (value == null) {
            return null;
        }
        if (value.signum() < 0 || value.compareTo(HUNDRED) > 0) {
            notes.add(new DataQualityNote(url, DataQualityNote.Kind.RATIO_OUT_OF_RANGE, field + "=" + value.toPlainString()));
            return null;
        }
        return value;
    }
}
