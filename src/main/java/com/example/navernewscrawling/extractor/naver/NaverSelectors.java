package com.example.navernewscrawling.extractor.naver;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * 네이버 뉴스 페이지 CSS 선택자와 라벨
 *
 * 사이트 마크업이 바뀌면 코드 수정 없이 naver.selectors.* 설정으로 교체할 수 있습니다.
 * 쉼표로 구분된 선택자는 Jsoup이 순서대로 첫 매칭을 사용합니다.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "naver.selectors")
public class NaverSelectors {

    // --- 기사 본문 ---
    private String title = "#title_area span, h2.media_end_head_headline";
    private String content = "#dic_area, #newsct_article";
    private String author = ".media_end_head_journalist_name, .byline_s";
    private String publishDate = "span.media_end_head_info_datestamp_time";
    private String publishDateAttribute = "data-date-time";
    private String category = "em.media_end_categorize_item";
    private String likeCount = ".u_likeit_text._count.num";
    private String commentCount = "#comment_count, .media_end_head_cmtcount_button";

    // --- 댓글 영역 이동 ---
    private String commentButton = ".u_cbox_btn_view_comment";
    private String moreButton = ".u_cbox_btn_more";
    private String replyButton = "a.u_cbox_btn_reply";

    // --- 클린봇 설정 ---
    private String cleanbotContainer = ".u_cbox_cleanbot";
    private String cleanbotMessage = ".u_cbox_cleanbot_setting_text, .u_cbox_cleanbot_text";
    /** 이 문구가 보이면 이미 해제된 상태 */
    private String cleanbotOffLabel = "착한댓글";
    private String cleanbotSettingButton = ".u_cbox_cleanbot_setbutton";
    private String cleanbotModal = ".u_cbox_layer_cleanbot2_wrap, .u_cbox_layer_cleanbot2";
    private String cleanbotCheckbox = "#cleanbot_dialog_checkbox_cbox_module, .u_cbox_layer_cleanbot2_checkbox, input[data-action='toggleCleanbot2']";
    private String cleanbotCheckedClass = "is_checked";
    private String cleanbotConfirmButton = "button[data-action='updateCleanbotStatus'], .u_cbox_layer_cleanbot2_extrabtn";
    private String cleanbotCloseButton = "button[data-action='closeCleanbotLayer']";

    // --- 댓글 통계 ---
    private String statItem = ".u_cbox_count_info";
    private String statTitle = ".u_cbox_info_title";
    private String statValue = ".u_cbox_info_txt";
    private String activeCommentLabel = "현재 댓글";
    private String deletedCommentLabel = "삭제";
    private String removedCommentLabel = "규정 미준수";

    // --- 성별/연령 분포 ---
    private String demographicContainer = ".u_cbox_chart_wrap";
    private String maleRatio = ".u_cbox_chart_male .u_cbox_chart_per";
    private String femaleRatio = ".u_cbox_chart_female .u_cbox_chart_per";
    private String ageItem = ".u_cbox_chart_age .u_cbox_chart_progress";
    private String ageLabel = ".u_cbox_chart_cnt span";
    private String agePercent = ".u_cbox_chart_per";
    /** 10대, 20대, 30대, 40대, 50대, 60대 이상 순서 */
    private List<String> ageLabels = new ArrayList<>(List.of("10대", "20대", "30대", "40대", "50대", "60대"));

    // --- 댓글 목록 ---
    private String commentItem = "li.u_cbox_comment";
    private String commentInfoAttribute = "data-info";
    private String commentContent = ".u_cbox_contents";
    private String commentAuthor = ".u_cbox_nick";
    private String commentLike = ".u_cbox_cnt_recomm";
    private String commentDislike = ".u_cbox_cnt_unrecomm";
    private String commentDate = ".u_cbox_date";
    private String commentDateAttribute = "data-value";
    private String deletedCommentText = "삭제된 댓글입니다";
}
