package com.example.navernewscrawling.writer;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVPrinter;
import org.apache.commons.csv.CSVRecord;
import org.apache.commons.io.FileUtils;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 이어쓰기 전 출력 파일 복구
 *
 * 프로세스가 기록 도중 죽으면 파일 끝에 잘린 행이나, 기사 행 없이 댓글 행만 남을 수 있습니다.
 * 기사 행이 커밋 표시이므로 다음 규칙으로 정리합니다.
 * - articles.csv 끝의 잘린 행 제거
 * - comments.csv에서 기사 행이 없는 article_id의 행 제거 (잘린 행 포함)
 * 제거한 행이 있으면 임시 파일에 다시 쓴 뒤 원자적으로 교체합니다.
 */
@Slf4j
public final class OutputRecovery {

    private static final CSVFormat READ_FORMAT = CsvTables.FORMAT.builder()
            .setHeader()
            .setSkipHeaderRecord(true)
            .build();

    private OutputRecovery() {
    }

    /**
     * @param outputDir articles.csv / comments.csv가 있는 디렉토리
     * @return 복구 후 최대 ID와 기록된 URL 목록
     */
    public static RecoveredOutput recover(Path outputDir) throws IOException {
        Path articlesFile = outputDir.resolve(CsvTables.ARTICLES_FILE);
        Path commentsFile = outputDir.resolve(CsvTables.COMMENTS_FILE);

        ParsedTable articles = parse(articlesFile, "article_id");
        Set<Long> articleIds = new HashSet<>();
        Set<String> urls = new LinkedHashSet<>();
        long lastArticleId = 0;
        for (List<String> row : articles.rows) {
            long id = parseLongOrZero(row.get(0));
            articleIds.add(id);
            urls.add(row.get(1));
            lastArticleId = Math.max(lastArticleId, id);
        }

        ParsedTable comments = parse(commentsFile, "article_id");
        List<List<String>> keptComments = new ArrayList<>(comments.rows.size());
        long lastCommentId = 0;
        int orphanComments = 0;
        for (List<String> row : comments.rows) {
            if (!articleIds.contains(parseLongOrZero(row.get(0)))) {
                orphanComments++;
                continue;
            }
            keptComments.add(row);
            lastCommentId = Math.max(lastCommentId, parseLongOrZero(row.get(1)));
        }

        int droppedArticles = articles.dropped;
        int droppedComments = comments.dropped + orphanComments;
        if (droppedArticles > 0 || articles.missingLineFeed) {
            rewrite(articlesFile, CsvTables.ARTICLE_HEADERS, articles.rows);
        }
        if (droppedComments > 0 || comments.missingLineFeed) {
            rewrite(commentsFile, CsvTables.COMMENT_HEADERS, keptComments);
        }
        if (droppedArticles > 0 || droppedComments > 0) {
            log.warn("출력 파일 복구: 기사 행 {}개, 댓글 행 {}개 제거", droppedArticles, droppedComments);
        }
        log.info("기존 출력: 기사 {}개 (마지막 ID {}), 댓글 마지막 ID {}", urls.size(), lastArticleId, lastCommentId);

        return RecoveredOutput.builder()
                .lastArticleId(lastArticleId)
                .lastCommentId(lastCommentId)
                .writtenUrls(urls)
                .droppedArticleRows(droppedArticles)
                .droppedCommentRows(droppedComments)
                .build();
    }

    /**
     * 완전한 행만 읽습니다. 파일이 줄바꿈으로 끝나지 않으면 마지막 행은 잘린 것으로 봅니다.
     * CR까지 기록되고 LF만 빠진 경우는 완전한 행입니다 (모든 값이 따옴표로 닫혀 있음).
     */
    private static ParsedTable parse(Path file, String idColumn) throws IOException {
        ParsedTable table = new ParsedTable();
        if (!Files.exists(file) || Files.size(file) == 0) {
            return table;
        }
        String content = FileUtils.readFileToString(file.toFile(), StandardCharsets.UTF_8);
        boolean tornTail = !content.endsWith("\n") && !content.endsWith("\r");
        table.missingLineFeed = content.endsWith("\r");

        List<CSVRecord> records = new ArrayList<>();
        int expectedColumns;
        try (CSVParser parser = CSVParser.parse(content, READ_FORMAT)) {
            expectedColumns = parser.getHeaderNames().size();
            Iterator<CSVRecord> it = parser.iterator();
            while (true) {
                try {
                    if (!it.hasNext()) {
                        break;
                    }
                    records.add(it.next());
                } catch (UncheckedIOException | IllegalStateException e) {
                    // 닫히지 않은 따옴표 등 파일 끝의 잘린 행
                    log.debug("{} 끝의 잘린 행 무시: {}", file.getFileName(), e.getMessage());
                    table.dropped++;
                    tornTail = false;
                    break;
                }
            }
        }
        if (tornTail && !records.isEmpty()) {
            records.remove(records.size() - 1);
            table.dropped++;
        }

        for (CSVRecord record : records) {
            if (record.size() != expectedColumns || parseLongOrNull(record.get(idColumn)) == null) {
                table.dropped++;
                continue;
            }
            table.rows.add(record.toList());
        }
        return table;
    }

    private static void rewrite(Path file, String[] headers, List<List<String>> rows) throws IOException {
        Path temp = file.resolveSibling(file.getFileName() + ".tmp");
        CSVFormat format = CsvTables.FORMAT.builder().setHeader(headers).build();
        try (BufferedWriter writer = Files.newBufferedWriter(temp, StandardCharsets.UTF_8);
             CSVPrinter printer = new CSVPrinter(writer, format)) {
            for (List<String> row : rows) {
                printer.printRecord(row);
            }
        }
        Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }

    private static Long parseLongOrNull(String value) {
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static long parseLongOrZero(String value) {
        Long parsed = parseLongOrNull(value);
        return parsed == null ? 0 : parsed;
    }

    private static final class ParsedTable {
        private final List<List<String>> rows = new ArrayList<>();
        private int dropped;
        /** 마지막 행이 CR로만 끝남. 다시 써서 CRLF로 맞춤 */
        private boolean missingLineFeed;
    }
}
