package com.example.navernewscrawling.writer;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class OutputRecoveryTest {

    private static final String ARTICLE_HEADER = "\"article_id\",\"url\",\"title\",\"content\",\"author\",\"publish_date\",\"category\","
            + "\"like_count\",\"comment_count\",\"active_comment_count\",\"deleted_comment_count\",\"removed_comment_count\","
            + "\"male_ratio\",\"female_ratio\",\"age_10s_ratio\",\"age_20s_ratio\",\"age_30s_ratio\",\"age_40s_ratio\","
            + "\"age_50s_ratio\",\"age_60plus_ratio\",\"scraped_at\"\r\n";
    private static final String COMMENT_HEADER = "\"article_id\",\"comment_id\",\"parent_comment_id\",\"comment_type\",\"content\","
            + "\"author\",\"like_count\",\"dislike_count\",\"reply_count\",\"created_at\",\"scraped_at\"\r\n";

    @TempDir
    Path dir;

    private static String articleRow(long id, String url) {
        return "\"" + id + "\",\"" + url + "\",\"제목\",\"본문\",\"\",\"\",\"\",\"\",\"\",\"\",\"\",\"\",\"\",\"\",\"\",\"\",\"\",\"\",\"\",\"\",\"2024-05-01 12:00:00\"\r\n";
    }

    private static String commentRow(long articleId, long commentId) {
        return "\"" + articleId + "\",\"" + commentId + "\",\"\",\"comment\",\"내용\",\"\",\"0\",\"0\",\"0\",\"\",\"2024-05-01 12:00:00\"\r\n";
    }

    private void write(String file, String content) throws IOException {
        Files.writeString(dir.resolve(file), content, StandardCharsets.UTF_8);
    }

    @Test
    void emptyDirectoryHasNothingToRecover() throws IOException {
        RecoveredOutput recovered = OutputRecovery.recover(dir);

        assertEquals(0, recovered.getLastArticleId());
        assertEquals(0, recovered.getLastCommentId());
        assertTrue(recovered.getWrittenUrls().isEmpty());
        assertFalse(recovered.isRepaired());
    }

    @Test
    void cleanFilesAreReadWithoutRewriting() throws IOException {
        String articles = ARTICLE_HEADER + articleRow(1, "https://a") + articleRow(2, "https://b");
        write(CsvTables.ARTICLES_FILE, articles);
        write(CsvTables.COMMENTS_FILE, COMMENT_HEADER + commentRow(1, 1) + commentRow(1, 2) + commentRow(2, 3));

        RecoveredOutput recovered = OutputRecovery.recover(dir);

        assertEquals(2, recovered.getLastArticleId());
        assertEquals(3, recovered.getLastCommentId());
        assertEquals(Set.of("https://a", "https://b"), recovered.getWrittenUrls());
        assertFalse(recovered.isRepaired());
        assertEquals(articles, Files.readString(dir.resolve(CsvTables.ARTICLES_FILE), StandardCharsets.UTF_8));
    }

    @Test
    void commentsOfUncommittedArticleAreDropped() throws IOException {
        // 기사 2의 댓글을 쓰는 도중 종료: 기사 행 없음
        write(CsvTables.ARTICLES_FILE, ARTICLE_HEADER + articleRow(1, "https://a"));
        write(CsvTables.COMMENTS_FILE, COMMENT_HEADER + commentRow(1, 1) + commentRow(2, 2) + "\"2\",\"3\",\"\",\"comm");

        RecoveredOutput recovered = OutputRecovery.recover(dir);

        assertEquals(1, recovered.getLastArticleId());
        assertEquals(1, recovered.getLastCommentId());
        assertEquals(2, recovered.getDroppedCommentRows());
        List<String> lines = Files.readAllLines(dir.resolve(CsvTables.COMMENTS_FILE), StandardCharsets.UTF_8);
        assertEquals(2, lines.size());
        assertTrue(lines.get(1).startsWith("\"1\",\"1\""));
    }

    @Test
    void tornArticleRowIsDroppedWithItsComments() throws IOException {
        String torn = articleRow(2, "https://b");
        write(CsvTables.ARTICLES_FILE, ARTICLE_HEADER + articleRow(1, "https://a") + torn.substring(0, torn.length() - 10));
        write(CsvTables.COMMENTS_FILE, COMMENT_HEADER + commentRow(1, 1) + commentRow(2, 2));

        RecoveredOutput recovered = OutputRecovery.recover(dir);

        assertEquals(1, recovered.getLastArticleId());
        assertEquals(Set.of("https://a"), recovered.getWrittenUrls());
        assertEquals(1, recovered.getDroppedArticleRows());
        assertEquals(1, recovered.getDroppedCommentRows());
        assertEquals(ARTICLE_HEADER + articleRow(1, "https://a"),
                Files.readString(dir.resolve(CsvTables.ARTICLES_FILE), StandardCharsets.UTF_8));
        assertFalse(Files.exists(dir.resolve(CsvTables.ARTICLES_FILE + ".tmp")));
    }

    @Test
    void rowEndingInCarriageReturnIsKept() throws IOException {
        String articles = ARTICLE_HEADER + articleRow(1, "https://a");
        // CR 뒤 LF를 쓰기 전에 종료
        write(CsvTables.ARTICLES_FILE, articles.substring(0, articles.length() - 1));
        write(CsvTables.COMMENTS_FILE, COMMENT_HEADER + commentRow(1, 1) + commentRow(1, 2));

        RecoveredOutput recovered = OutputRecovery.recover(dir);

        assertEquals(1, recovered.getLastArticleId());
        assertEquals(2, recovered.getLastCommentId());
        assertEquals(Set.of("https://a"), recovered.getWrittenUrls());
        assertEquals(0, recovered.getDroppedArticleRows());
        assertEquals(0, recovered.getDroppedCommentRows());
        assertEquals(articles, Files.readString(dir.resolve(CsvTables.ARTICLES_FILE), StandardCharsets.UTF_8));
    }
}
