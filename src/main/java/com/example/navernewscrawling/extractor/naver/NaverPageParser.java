package com.example.navernewscrawling.extractor.naver;

import com.example.navernewscrawling.extractor.RawArticleFields;
import com.example.navernewscrawling.extractor.RawCommentRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 네이버 뉴스 HTML 파서
 *
 * Selenium이 렌더링한 페이지 소스를 Jsoup으로 파싱해 원시 필드를 만듭니다.
 * 브라우저와 분리되어 있어 저장해 둔 HTML로 테스트할 수 있습니다.
 */
@Slf4j
@RequiredArgsConstructor
public class NaverPageParser {

    private static final Pattern NUMBER = Pattern.compile("\\d[\\d,]*");
    private static final Pattern DECIMAL = Pattern.compile("\\d+(?:\\.\\d+)?");
    private static final Pattern INFO_ENTRY = Pattern.compile("['\"]?(\\w+)['\"]?\\s*:\\s*(?:'([^']*)'|\"([^\"]*)\"|([^,}\\s]+))");

    private final NaverSelectors selectors;

    /**
     * 기사 메타데이터, 댓글 통계, 성별/연령 분포를 파싱합니다.
     */
    public RawArticleFields parseArticle(Document doc) {
        RawArticleFields.RawArticleFieldsBuilder builder = RawArticleFields.builder()
                .title(textOrNull(doc, selectors.getTitle()))
                .content(textOrNull(doc, selectors.getContent()))
                .author(textOrNull(doc, selectors.getAuthor()))
                .publishDate(publishDate(doc))
                .category(textOrNull(doc, selectors.getCategory()))
                .likeCount(firstNumber(textOrNull(doc, selectors.getLikeCount())))
                .commentCount(firstNumber(textOrNull(doc, selectors.getCommentCount())));

        parseCommentStats(doc, builder);
        parseDemographics(doc, builder);
        return builder.build();
    }

    /**
     * 현재 렌더링된 모든 댓글/답글을 문서 순서대로 파싱합니다.
     * 답글 영역은 부모 댓글 요소 안에 있으므로 부모가 항상 먼저 나옵니다.
     */
    public List<RawCommentRecord> parseComments(Document doc) {
        List<RawCommentRecord> records = new ArrayList<>();
        for (Element item : doc.select(selectors.getCommentItem())) {
            Map<String, String> info = parseDataInfo(item.attr(selectors.getCommentInfoAttribute()));
            String siteId = blankToNull(info.get("commentNo"));
            boolean deleted = "true".equalsIgnoreCase(info.get("deleted"));

            RawCommentRecord.RawCommentRecordBuilder record = RawCommentRecord.builder()
                    .siteId(siteId)
                    .parentSiteId(parentSiteId(siteId, info))
                    .author(ownTextOrNull(item, selectors.getCommentAuthor()))
                    .createdAt(commentDate(item))
                    .deleted(deleted);

            if (deleted) {
                record.content(selectors.getDeletedCommentText());
            } else {
                record.content(ownTextOrNull(item, selectors.getCommentContent()))
                        .likeCount(orZero(firstNumber(ownTextOrNull(item, selectors.getCommentLike()))))
                        .dislikeCount(orZero(firstNumber(ownTextOrNull(item, selectors.getCommentDislike()))));
            }
            records.add(record.build());
        }
        log.debug("댓글 요소 {}개 파싱", records.size());
        return records;
    }

    private String publishDate(Document doc) {
        Element el = doc.selectFirst(selectors.getPublishDate());
        if (el == null) {
            return null;
        }
        String attr = el.attr(selectors.getPublishDateAttribute());
        return attr.isBlank() ? blankToNull(el.text()) : attr.trim();
    }

    private void parseCommentStats(Document doc, RawArticleFields.RawArticleFieldsBuilder builder) {
        for (Element item : doc.select(selectors.getStatItem())) {
            Element title = item.selectFirst(selectors.getStatTitle());
            Element value = item.selectFirst(selectors.getStatValue());
            if (title == null || value == null) {
                continue;
            }
            String label = title.text().trim();
            Long count = firstNumber(value.text());
            if (label.contains(selectors.getActiveCommentLabel())) {
                builder.activeCommentCount(count);
            } else if (label.contains(selectors.getDeletedCommentLabel())) {
                builder.deletedCommentCount(count);
            } else if (label.contains(selectors.getRemovedCommentLabel())) {
                builder.removedCommentCount(count);
            }
        }
    }

    private void parseDemographics(Document doc, RawArticleFields.RawArticleFieldsBuilder builder) {
        Element chart = doc.selectFirst(selectors.getDemographicContainer());
        if (chart == null) {
            return;
        }
        builder.maleRatio(percent(textOrNull(chart, selectors.getMaleRatio())));
        builder.femaleRatio(percent(textOrNull(chart, selectors.getFemaleRatio())));

        List<String> ageLabels = selectors.getAgeLabels();
        for (Element age : chart.select(selectors.getAgeItem())) {
            String label = textOrNull(age, selectors.getAgeLabel());
            BigDecimal ratio = percent(textOrNull(age, selectors.getAgePercent()));
            if (label == null) {
                continue;
            }
            switch (ageIndex(ageLabels, label)) {
                case 0:
                    builder.age10sRatio(ratio);
                    break;
                case 1:
                    builder.age20sRatio(ratio);
                    break;
                case 2:
                    builder.age30sRatio(ratio);
                    break;
                case 3:
                    builder.age40sRatio(ratio);
                    break;
                case 4:
                    builder.age50sRatio(ratio);
                    break;
                case 5:
                    builder.age60plusRatio(ratio);
                    break;
                default:
                    log.debug("알 수 없는 연령 라벨: {}", label);
            }
        }
    }

    /**
     * 라벨 순서대로 포함 여부를 봅니다. "60대 이상", "60대↑" 같은 변형도 매칭됩니다.
     */
    static int ageIndex(List<String> ageLabels, String label) {
        for (int i = 0; i < ageLabels.size(); i++) {
            if (label.contains(ageLabels.get(i))) {
                return i;
            }
        }
        return -1;
    }

    private String commentDate(Element item) {
        Element el = ownElement(item, selectors.getCommentDate());
        if (el == null) {
            return null;
        }
        String attr = el.attr(selectors.getCommentDateAttribute());
        return attr.isBlank() ? blankToNull(el.text()) : attr.trim();
    }

    /**
     * 최상위 댓글은 parentCommentNo가 자기 자신이거나 replyLevel이 1입니다.
     */
    private static String parentSiteId(String siteId, Map<String, String> info) {
        String parent = blankToNull(info.get("parentCommentNo"));
        if (parent == null || parent.equals(siteId) || "0".equals(parent) || "1".equals(info.get("replyLevel"))) {
            return null;
        }
        return parent;
    }

    private String ownTextOrNull(Element item, String cssQuery) {
        Element el = ownElement(item, cssQuery);
        return el == null ? null : blankToNull(el.text());
    }

    // 부모 댓글 요소 안에 답글 영역이 있으므로, 가장 가까운 댓글 요소가 자신인 매칭만 사용
    private Element ownElement(Element item, String cssQuery) {
        for (Element el : item.select(cssQuery)) {
            if (el.closest(selectors.getCommentItem()) == item) {
                return el;
            }
        }
        return null;
    }

    /**
     * data-info 속성 파싱. 예: {commentNo:'123', parentCommentNo:'100', replyLevel:2, deleted:false}
     */
    static Map<String, String> parseDataInfo(String dataInfo) {
        Map<String, String> values = new HashMap<>();
        if (dataInfo == null || dataInfo.isBlank()) {
            return values;
        }
        Matcher m = INFO_ENTRY.matcher(dataInfo);
        while (m.find()) {
            String value = m.group(2) != null ? m.group(2) : m.group(3) != null ? m.group(3) : m.group(4);
            values.put(m.group(1), value);
        }
        return values;
    }

    /**
     * "1,234" 같은 텍스트에서 첫 번째 정수를 추출합니다.
     *
     * @return 숫자가 없으면 null
     */
    static Long firstNumber(String text) {
        if (text == null) {
            return null;
        }
        Matcher m = NUMBER.matcher(text);
        if (!m.find()) {
            return null;
        }
        return Long.parseLong(m.group().replace(",", ""));
    }

    /**
     * "45%", "12.5%" 형식의 비율 텍스트를 숫자로 변환합니다. 범위 검사는 하지 않습니다.
     */
    static BigDecimal percent(String text) {
        if (text == null) {
            return null;
        }
        Matcher m = DECIMAL.matcher(text);
        return m.find() ? new BigDecimal(m.group()) : null;
    }

    private static String textOrNull(Element root, String cssQuery) {
        Element el = root.selectFirst(cssQuery);
        return el == null ? null : blankToNull(el.text());
    }

    private static String blankToNull(String s) {
        return (s == null || s.isBlank()) ? null : s.trim();
    }

    private static long orZero(Long value) {
        return value == null ? 0L : value;
    }
}
