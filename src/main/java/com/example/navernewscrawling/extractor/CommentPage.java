package com.example.navernewscrawling.extractor;

import lombok.Getter;

import java.util.List;
import java.util.Optional;

/**
 * 댓글 한 페이지 분량의 원시 레코드와 다음 커서
 *
 * 페이지 경계에서 이전 페이지와 겹치는 레코드가 들어 있을 수 있습니다.
 */
public class CommentPage {

    @Getter
    private final List<RawCommentRecord> records;
    private final CommentCursor nextCursor;

    private CommentPage(List<RawCommentRecord> records, CommentCursor nextCursor) {
        this.records = List.copyOf(records);
        this.nextCursor = nextCursor;
    }

    public static CommentPage of(List<RawCommentRecord> records, CommentCursor nextCursor) {
        return new CommentPage(records, nextCursor);
    }

    public static CommentPage last(List<RawCommentRecord> records) {
        return new CommentPage(records, null);
    }

    public Optional<CommentCursor> nextCursor() {
        return Optional.ofNullable(nextCursor);
    }

    public boolean isLast() {
        return nextCursor == null;
    }
}
