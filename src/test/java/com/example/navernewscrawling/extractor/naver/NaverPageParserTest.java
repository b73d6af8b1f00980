package com.example.navernewscrawling.extractor.naver;

import com.example.navernewscrawling.extractor.RawArticleFields;
import com.example.navernewscrawling.extractor.RawCommentRecord;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class NaverPageParserTest {

    private static final String ARTICLE_HTML = """
            <html><body>
              <div id="title_area"><span>정부, 새 정책 발표</span></div>
              <em class="media_end_categorize_item">정치</em>
              <span class="media_end_head_info_datestamp_time" data-date-time="2024-05-01 15:20:11">2024.05.01. 오후 3:20</span>
              <em class="media_end_head_journalist_name">홍길동 기자</em>
              <article id="dic_area">본문 첫 문단입니다.</article>
              <span class="u_likeit_text _count num">1,234</span>
              <a class="media_end_head_cmtcount_button">댓글 56</a>
              <ul>
                <li class="u_cbox_count_info"><span class="u_cbox_info_title">현재 댓글</span><span class="u_cbox_info_txt">50</span></li>
                <li class="u_cbox_count_info"><span class="u_cbox_info_title">작성자 삭제</span><span class="u_cbox_info_txt">4</span></li>
                <li class="u_cbox_count_info"><span class="u_cbox_info_title">규정 미준수</span><span class="u_cbox_info_txt">2</span></li>
              </ul>
              <div class="u_cbox_chart_wrap">
                <div class="u_cbox_chart_male"><span class="u_cbox_chart_per">62%</span></div>
                <div class="u_cbox_chart_female"><span class="u_cbox_chart_per">38%</span></div>
                <div class="u_cbox_chart_age">
                  <div class="u_cbox_chart_progress"><span class="u_cbox_chart_cnt"><span>10대</span></span><span class="u_cbox_chart_per">1%</span></div>
                  <div class="u_cbox_chart_progress"><span class="u_cbox_chart_cnt"><span>20대</span></span><span class="u_cbox_chart_per">9%</span></div>
                  <div class="u_cbox_chart_progress"><span class="u_cbox_chart_cnt"><span>30대</span></span><span class="u_cbox_chart_per">20%</span></div>
                  <div class="u_cbox_chart_progress"><span class="u_cbox_chart_cnt"><span>40대</span></span><span class="u_cbox_chart_per">30%</span></div>
                  <div class="u_cbox_chart_progress"><span class="u_cbox_chart_cnt"><span>50대</span></span><span class="u_cbox_chart_per">25.5%</span></div>
                  <div class="u_cbox_chart_progress"><span class="u_cbox_chart_cnt"><span>60대</span></span><span class="u_cbox_chart_per">14.5%</span></div>
                </div>
              </div>
            </body></html>
            """;

    private static final String COMMENTS_HTML = """
            <html><body><ul class="u_cbox_list">
              <li class="u_cbox_comment" data-info="commentNo:'100',parentCommentNo:'100',replyLevel:1,deleted:false">
                <span class="u_cbox_nick">reader1</span>
                <span class="u_cbox_contents">좋은 기사네요</span>
                <span class="u_cbox_date" data-value="2024-05-01T16:00:00+0900">1시간전</span>
                <em class="u_cbox_cnt_recomm">1,024</em><em class="u_cbox_cnt_unrecomm">3</em>
                <a class="u_cbox_btn_reply">답글 1</a>
                <div class="u_cbox_reply_area"><ul class="u_cbox_list">
                  <li class="u_cbox_comment" data-info="commentNo:'101',parentCommentNo:'100',replyLevel:2,deleted:false">
                    <span class="u_cbox_nick">reader2</span>
                    <span class="u_cbox_contents">동의합니다</span>
                    <em class="u_cbox_cnt_recomm">5</em><em class="u_cbox_cnt_unrecomm">0</em>
                  </li>
                </ul></div>
              </li>
              <li class="u_cbox_comment" data-info="commentNo:'102',parentCommentNo:'102',replyLevel:1,deleted:true">
                <span class="u_cbox_contents">원래 내용</span>
                <em class="u_cbox_cnt_recomm">9</em>
              </li>
              <li class="u_cbox_comment">
                <span class="u_cbox_contents">번호 없음</span>
              </li>
            </ul></body></html>
            """;

    private final NaverPageParser parser = new NaverPageParser(new NaverSelectors());

    @Test
    void parsesArticleMetadata() {
        RawArticleFields fields = parser.parseArticle(Jsoup.parse(ARTICLE_HTML));

        assertEquals("정부, 새 정책 발표", fields.getTitle());
        assertEquals("본문 첫 문단입니다.", fields.getContent());
        assertEquals("홍길동 기자", fields.getAuthor());
        assertEquals("2024-05-01 15:20:11", fields.getPublishDate());
        assertEquals("정치", fields.getCategory());
        assertEquals(1234L, fields.getLikeCount());
        assertEquals(56L, fields.getCommentCount());
    }

    @Test
    void parsesCommentStatsAndDemographics() {
        RawArticleFields fields = parser.parseArticle(Jsoup.parse(ARTICLE_HTML));

        assertEquals(50L, fields.getActiveCommentCount());
        assertEquals(4L, fields.getDeletedCommentCount());
        assertEquals(2L, fields.getRemovedCommentCount());
        assertEquals(new BigDecimal("62"), fields.getMaleRatio());
        assertEquals(new BigDecimal("38"), fields.getFemaleRatio());
        assertEquals(new BigDecimal("1"), fields.getAge10sRatio());
        assertEquals(new BigDecimal("25.5"), fields.getAge50sRatio());
        assertEquals(new BigDecimal("14.5"), fields.getAge60plusRatio());
    }

    @Test
    void ageLabelVariantsMatchByContainment() {
        String html = """
                <html><body><div class="u_cbox_chart_wrap"><div class="u_cbox_chart_age">
                  <div class="u_cbox_chart_progress"><span class="u_cbox_chart_cnt"><span>20대 </span></span><span class="u_cbox_chart_per">9%</span></div>
                  <div class="u_cbox_chart_progress"><span class="u_cbox_chart_cnt"><span>60대↑</span></span><span class="u_cbox_chart_per">14%</span></div>
                </div></div></body></html>
                """;

        RawArticleFields fields = parser.parseArticle(Jsoup.parse(html));

        assertEquals(new BigDecimal("9"), fields.getAge20sRatio());
        assertEquals(new BigDecimal("14"), fields.getAge60plusRatio());
    }

    @Test
    void ageIndexFollowsLabelOrder() {
        List<String> labels = new NaverSelectors().getAgeLabels();

        assertEquals(5, NaverPageParser.ageIndex(labels, "60대 이상"));
        assertEquals(0, NaverPageParser.ageIndex(labels, "10대"));
        assertEquals(-1, NaverPageParser.ageIndex(labels, "기타"));
    }

    @Test
    void missingElementsBecomeNull() {
        RawArticleFields fields = parser.parseArticle(Jsoup.parse("<html><body><p>empty</p></body></html>"));

        assertNull(fields.getTitle());
        assertNull(fields.getLikeCount());
        assertNull(fields.getCommentCount());
        assertNull(fields.getMaleRatio());
    }

    @Test
    void parsesCommentsWithReplyHierarchy() {
        Document doc = Jsoup.parse(COMMENTS_HTML);

        List<RawCommentRecord> records = parser.parseComments(doc);

        assertEquals(4, records.size());
        RawCommentRecord top = records.get(0);
        assertEquals("100", top.getSiteId());
        assertFalse(top.hasParent());
        assertEquals("reader1", top.getAuthor());
        assertEquals("좋은 기사네요", top.getContent());
        assertEquals(1024L, top.getLikeCount());
        assertEquals(3L, top.getDislikeCount());
        assertEquals("2024-05-01T16:00:00+0900", top.getCreatedAt());

        RawCommentRecord reply = records.get(1);
        assertEquals("101", reply.getSiteId());
        assertEquals("100", reply.getParentSiteId());
        assertEquals("동의합니다", reply.getContent());
        assertEquals(5L, reply.getLikeCount());
    }

    @Test
    void deletedCommentGetsPlaceholderAndZeroCounters() {
        RawCommentRecord deleted = parser.parseComments(Jsoup.parse(COMMENTS_HTML)).get(2);

        assertTrue(deleted.isDeleted());
        assertEquals("삭제된 댓글입니다", deleted.getContent());
        assertEquals(0L, deleted.getLikeCount());
    }

    @Test
    void commentWithoutDataInfoHasNoSiteId() {
        RawCommentRecord record = parser.parseComments(Jsoup.parse(COMMENTS_HTML)).get(3);

        assertNull(record.getSiteId());
    }

    @Test
    void dataInfoAcceptsQuotedAndBareValues() {
        Map<String, String> info = NaverPageParser.parseDataInfo("{commentNo:'12',\"replyLevel\":2, deleted:true, parentCommentNo:\"7\"}");

        assertEquals("12", info.get("commentNo"));
        assertEquals("2", info.get("replyLevel"));
        assertEquals("true", info.get("deleted"));
        assertEquals("7", info.get("parentCommentNo"));
    }

    @Test
    void numberHelpers() {
        assertEquals(12345L, NaverPageParser.firstNumber("공감 12,345"));
        assertNull(NaverPageParser.firstNumber("없음"));
        assertEquals(new BigDecimal("45.5"), NaverPageParser.percent("45.5%"));
        assertNull(NaverPageParser.percent(null));
    }
}
