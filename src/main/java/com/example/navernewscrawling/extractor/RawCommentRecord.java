package com.example.navernewscrawling.extractor;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * 댓글 스트림의 원시 레코드
 *
 * siteId는 사이트가 부여한 댓글 번호이고, parentSiteId가 null이면 최상위 댓글입니다.
 */
@Getter
@Builder
@ToString
public class RawCommentRecord {
    private final String siteId;
    private final String parentSiteId;
    private final String content;
    private final String author;
    private final long likeCount;
    private final long dislikeCount;
    private final String createdAt;
    private final boolean deleted;

    public boolean hasParent() {
        return parentSiteId != null && !parentSiteId.isBlank();
    }
}
