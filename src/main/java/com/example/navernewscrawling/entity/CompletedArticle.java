package com.example.navernewscrawling.entity;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.List;

/**
 * 추출이 끝나 Writer로 넘어가는 기사 한 건 (기사 + 댓글 + 데이터 품질 노트)
 *
 * 기사와 댓글의 articleId는 아직 비어 있으며 커밋 시점에 채워집니다.
 */
@Getter
@RequiredArgsConstructor
public class CompletedArticle {

    private final Article article;
    private final List<Comment> comments;
    private final List<DataQualityNote> notes;

    public String getUrl() {
        return article.getUrl();
    }
}
