package com.example.navernewscrawling.writer;

import lombok.Builder;
import lombok.Getter;

import java.util.Set;

/**
 * 기존 출력 파일 복구 결과
 */
@Getter
@Builder
public class RecoveredOutput {

    /** 기록된 기사가 없으면 0 */
    private final long lastArticleId;

    /** 기록된 댓글이 없으면 0 */
    private final long lastCommentId;

    /** 이미 기록된 기사 URL (이번 실행에서 건너뜀) */
    private final Set<String> writtenUrls;

    private final int droppedArticleRows;
    private final int droppedCommentRows;

    public static RecoveredOutput empty() {
        return RecoveredOutput.builder().writtenUrls(Set.of()).build();
    }

    public boolean isRepaired() {
        return droppedArticleRows > 0 || droppedCommentRows > 0;
    }
}
