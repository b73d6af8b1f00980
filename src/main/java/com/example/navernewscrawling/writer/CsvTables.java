package com.example.navernewscrawling.writer;

import com.example.navernewscrawling.entity.Article;
import com.example.navernewscrawling.entity.Comment;
import com.example.navernewscrawling.util.DateTimes;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.apache.commons.csv.QuoteMode;

import java.io.BufferedWriter;
import java.io.Closeable;
import java.io.IOException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Arrays;
import java.util.List;

/**
 * articles.csv / comments.csv 출력 형식
 *
 * 모든 값은 큰따옴표로 감싸고, 값이 없으면 빈 문자열로 기록합니다.
 * 헤더는 새 파일(또는 빈 파일)에만 씁니다.
 */
public class CsvTables implements Closeable {

    public static final String ARTICLES_FILE = "articles.csv";
    public static final String COMMENTS_FILE = "comments.csv";

    public static final String[] ARTICLE_HEADERS = {
            "article_id", "url", "title", "content", "author", "publish_date", "category",
            "like_count", "comment_count", "active_comment_count", "deleted_comment_count", "removed_comment_count",
            "male_ratio", "female_ratio",
            "age_10s_ratio", "age_20s_ratio", "age_30s_ratio", "age_40s_ratio", "age_50s_ratio", "age_60plus_ratio",
            "scraped_at"
    };

    public static final String[] COMMENT_HEADERS = {
            "article_id", "comment_id", "parent_comment_id", "comment_type", "content", "author",
            "like_count", "dislike_count", "reply_count", "created_at", "scraped_at"
    };

    /** 기본 형식 (CRLF 레코드 구분, 전체 인용) */
    static final CSVFormat FORMAT = CSVFormat.DEFAULT.builder()
            .setQuoteMode(QuoteMode.ALL)
            .build();

    private final CSVPrinter articles;
    private final CSVPrinter comments;

    private CsvTables(CSVPrinter articles, CSVPrinter comments) {
        this.articles = articles;
        this.comments = comments;
    }

    /**
     * 출력 파일을 엽니다.
     *
     * @param append true면 기존 내용 뒤에 이어서 기록, false면 기존 파일을 비움
     */
    public static CsvTables open(Path outputDir, boolean append) throws IOException {
        Files.createDirectories(outputDir);
        CSVPrinter articles = openPrinter(outputDir.resolve(ARTICLES_FILE), ARTICLE_HEADERS, append);
        try {
            CSVPrinter comments = openPrinter(outputDir.resolve(COMMENTS_FILE), COMMENT_HEADERS, append);
            return new CsvTables(articles, comments);
        } catch (IOException e) {
            articles.close();
            throw e;
        }
    }

    private static CSVPrinter openPrinter(Path file, String[] headers, boolean append) throws IOException {
        boolean isNewFile = !append || !Files.exists(file) || Files.size(file) == 0;

        CSVFormat.Builder formatBuilder = FORMAT.builder();
        if (isNewFile) {
            formatBuilder.setHeader(headers);
        }

        BufferedWriter writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE,
                append ? StandardOpenOption.APPEND : StandardOpenOption.TRUNCATE_EXISTING,
                StandardOpenOption.WRITE);
        CSVPrinter printer = new CSVPrinter(writer, formatBuilder.build());
        printer.flush();
        return printer;
    }

    /**
     * 기사 한 건을 기록합니다. 댓글 행을 먼저 쓰고, 기사 행을 마지막에 씁니다.
     * 기사 행이 있으면 그 기사의 댓글은 모두 기록된 상태입니다.
     */
    public void writeUnit(Article article, List<Comment> articleComments) throws IOException {
        for (Comment comment : articleComments) {
            comments.printRecord(commentRow(comment));
        }
        comments.flush();
        articles.printRecord(articleRow(article));
        articles.flush();
    }

    static List<String> articleRow(Article a) {
        return Arrays.asList(
                number(a.getArticleId()),
                text(a.getUrl()),
                text(a.getTitle()),
                text(a.getContent()),
                text(a.getAuthor()),
                text(a.getPublishDate()),
                text(a.getCategory()),
                number(a.getLikeCount()),
                number(a.getCommentCount()),
                number(a.getActiveCommentCount()),
                number(a.getDeletedCommentCount()),
                number(a.getRemovedCommentCount()),
                ratio(a.getMaleRatio()),
                ratio(a.getFemaleRatio()),
                ratio(a.getAge10sRatio()),
                ratio(a.getAge20sRatio()),
                ratio(a.getAge30sRatio()),
                ratio(a.getAge40sRatio()),
                ratio(a.getAge50sRatio()),
                ratio(a.getAge60plusRatio()),
                text(DateTimes.format(a.getScrapedAt()))
        );
    }

    static List<String> commentRow(Comment c) {
        return Arrays.asList(
                number(c.getArticleId()),
                String.valueOf(c.getCommentId()),
                number(c.getParentCommentId()),
                c.getCommentType().csvValue(),
                text(c.getContent()),
                text(c.getAuthor()),
                String.valueOf(c.getLikeCount()),
                String.valueOf(c.getDislikeCount()),
                String.valueOf(c.getReplyCount()),
                text(c.getCreatedAt()),
                text(DateTimes.format(c.getScrapedAt()))
        );
    }

    static String text(String value) {
        return value == null ? "" : value;
    }

    static String number(Long value) {
        return value == null ? "" : value.toString();
    }

    /** 소수점 둘째 자리 (예: 45 → "45.00") */
    static String ratio(BigDecimal value) {
        return value == null ? "" : value.setScale(2, RoundingMode.HALF_UP).toPlainString();
    }

    @Override
    public void close() throws IOException {
        try {
            comments.close(true);
        } finally {
            articles.close(true);
        }
    }
}
