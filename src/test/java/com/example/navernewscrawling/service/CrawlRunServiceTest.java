package com.example.navernewscrawling.service;

import com.example.navernewscrawling.config.CrawlerProperties;
import com.example.navernewscrawling.entity.CrawlStatus;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static com.example.navernewscrawling.service.FakeArticleExtractor.reply;
import static com.example.navernewscrawling.service.FakeArticleExtractor.top;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CrawlRunServiceTest {

    private static final String A = "https://n.news.naver.com/article/001/A";
    private static final String B = "https://n.news.naver.com/article/001/B";
    private static final String C = "https://n.news.naver.com/article/001/C";

    private static final CSVFormat READ = CSVFormat.DEFAULT.builder().setHeader().setSkipHeaderRecord(true).build();

    @TempDir
    Path outputDir;

    private FakeArticleExtractor extractor;
    private CrawlerProperties properties;
    private CrawlProgressTracker tracker;
    private CrawlRunService service;

    @BeforeEach
    void setUp() {
        extractor = new FakeArticleExtractor();
        properties = new CrawlerProperties();
        properties.setDelayBetweenRequests(Duration.ZERO);
        properties.setRetryBackoff(Duration.ZERO);
        properties.setRetryCount(1);
        properties.setMaxWorkers(2);
        tracker = new CrawlProgressTracker();
        Clock clock = Clock.fixed(Instant.parse("2024-05-01T03:00:00Z"), ZoneId.of("Asia/Seoul"));
        service = new CrawlRunService(extractor, properties, tracker, clock);

        FakeArticleExtractor.Script a = extractor.script(A);
        a.pages.add(List.of(top("a1"), reply("a2", "a1")));

        extractor.script(B).loadFailures = Integer.MAX_VALUE;

        FakeArticleExtractor.Script c = extractor.script(C);
        c.pageDelayMillis = 50;
        c.pages.add(List.of(top("c1"), top("c2")));
        c.pages.add(List.of(top("c1"), top("c2"), reply("c3", "c2"), top("c4")));
    }

    @Test
    void writesSucceededArticlesAndReportsFailures() throws IOException {
        RunSummary summary = service.run(List.of(A, B, C), outputDir);

        assertEquals(3, summary.getTotalUrls());
        assertEquals(2, summary.getSucceeded());
        assertEquals(1, summary.getFailed());
        assertEquals(1, summary.exitCode());
        assertEquals(B, summary.getFailures().get(0).getUrl());
        assertEquals(2, summary.getFailures().get(0).getAttempts());
        assertEquals(6, summary.getCommentsWritten());

        List<CSVRecord> articles = read(outputDir.resolve("articles.csv"));
        List<CSVRecord> comments = read(outputDir.resolve("comments.csv"));
        assertEquals(2, articles.size());
        assertEquals(6, comments.size());
        assertFalse(articles.stream().anyMatch(r -> r.get("url").equals(B)));

        assertEquals(CrawlStatus.FAILED, tracker.statusOf(B));
        assertEquals(CrawlStatus.COMPLETED, tracker.statusOf(A));
        assertEquals(2L, service.getCrawlStatus().get("COMPLETED"));
    }

    @Test
    void rowsOfConcurrentArticlesAreNotInterleaved() throws IOException {
        service.run(List.of(C, A), outputDir);

        List<CSVRecord> articles = read(outputDir.resolve("articles.csv"));
        List<CSVRecord> comments = read(outputDir.resolve("comments.csv"));

        // 기록 순서대로 article_id 증가
        assertEquals("1", articles.get(0).get("article_id"));
        assertEquals("2", articles.get(1).get("article_id"));

        // 댓글 행은 기사별로 연속된 묶음
        List<String> commentArticleIds = comments.stream().map(r -> r.get("article_id")).collect(Collectors.toList());
        List<String> sorted = commentArticleIds.stream().sorted().collect(Collectors.toList());
        assertEquals(sorted, commentArticleIds);

        // 답글은 같은 기사의 최상위 댓글을 가리킴
        for (CSVRecord row : comments) {
            if (row.get("comment_type").equals("reply")) {
                CSVRecord parent = comments.stream()
                        .filter(p -> p.get("comment_id").equals(row.get("parent_comment_id")))
                        .findFirst().orElseThrow();
                assertEquals("comment", parent.get("comment_type"));
                assertEquals(row.get("article_id"), parent.get("article_id"));
            }
        }

        Set<String> ids = new HashSet<>();
        comments.forEach(r -> assertTrue(ids.add(r.get("comment_id"))));
    }

    @Test
    void failedUrlsFileCanBeFedBack() throws IOException {
        RunSummary summary = service.run(List.of(A, B), outputDir);

        assertNotNull(summary.getFailedUrlsFile());
        Path failedFile = Path.of(summary.getFailedUrlsFile());
        assertEquals("failed_urls_20240501_120000.txt", failedFile.getFileName().toString());
        assertEquals(List.of(B), UrlListLoader.load(failedFile));
    }

    @Test
    void resumedRunSkipsWrittenUrlsAndContinuesIds() throws IOException {
        service.run(List.of(A), outputDir);

        RunSummary second = service.run(List.of(A, C), outputDir);

        assertEquals(1, second.getSkipped());
        assertEquals(1, second.getSucceeded());
        assertEquals(0, second.exitCode());
        assertNull(second.getFailedUrlsFile());
        assertEquals(CrawlStatus.SKIPPED, tracker.statusOf(A));

        List<CSVRecord> articles = read(outputDir.resolve("articles.csv"));
        assertEquals(2, articles.size());
        assertEquals(C, articles.get(1).get("url"));
        assertEquals("2", articles.get(1).get("article_id"));

        List<CSVRecord> comments = read(outputDir.resolve("comments.csv"));
        assertEquals(6, comments.size());
        assertEquals("3", comments.get(2).get("comment_id"));
        assertEquals(1, extractor.loadAttempts(A));
    }

    @Test
    void resumeDisabledReplacesExistingOutput() throws IOException {
        service.run(List.of(A), outputDir);
        properties.getOutput().setResume(false);

        service.run(List.of(C), outputDir);

        List<CSVRecord> articles = read(outputDir.resolve("articles.csv"));
        assertEquals(1, articles.size());
        assertEquals(C, articles.get(0).get("url"));
        assertEquals("1", articles.get(0).get("article_id"));
    }

    @Test
    void cancelledRunWritesNothingPartial() throws Exception {
        FakeArticleExtractor.Script slow = extractor.script(C);
        slow.pageDelayMillis = 2000;
        properties.setMaxWorkers(1);

        Thread runner = new Thread(() -> service.run(List.of(C, A), outputDir));
        runner.start();
        Thread.sleep(300);
        service.cancel();
        runner.join(10_000);

        RunSummary summary = service.getLastSummary().orElseThrow();
        assertEquals(0, summary.getSucceeded());
        assertEquals(2, summary.getFailed());
        assertTrue(summary.getFailures().stream().allMatch(f -> f.getReason().equals(ArticleOutcome.CANCELLED)
                || f.getReason().contains("interrupted")));
        assertTrue(read(outputDir.resolve("comments.csv")).isEmpty());
        assertTrue(read(outputDir.resolve("articles.csv")).isEmpty());
    }

    @Test
    void secondConcurrentRunIsRejected() throws Exception {
        extractor.script(C).pageDelayMillis = 500;
        assertTrue(service.startAsync(List.of(C), outputDir));

        assertFalse(service.startAsync(List.of(A), outputDir));
        assertThrows(IllegalStateException.class, () -> service.run(List.of(A), outputDir));

        assertTrue(service.awaitIdle(Duration.ofSeconds(10)));
        assertEquals(1, service.getLastSummary().orElseThrow().getSucceeded());
    }

    private static List<CSVRecord> read(Path file) throws IOException {
        try (CSVParser parser = CSVParser.parse(file, StandardCharsets.UTF_8, READ)) {
            return parser.getRecords();
        }
    }

    @Test
    void outputFilesUseQuotedCrlfRows() throws IOException {
        service.run(List.of(A), outputDir);

        String content = Files.readString(outputDir.resolve("articles.csv"), StandardCharsets.UTF_8);
        assertTrue(content.startsWith("\"article_id\",\"url\",\"title\""));
        assertTrue(content.endsWith("\r\n"));
        try (Stream<String> lines = Files.lines(outputDir.resolve("comments.csv"), StandardCharsets.UTF_8)) {
            assertEquals(3, lines.count());
        }
    }
}
