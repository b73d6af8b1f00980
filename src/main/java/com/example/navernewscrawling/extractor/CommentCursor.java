package com.example.navernewscrawling.extractor;

import lombok.Value;

/**
 * 댓글 페이지 위치 ("더보기" 클릭 횟수)
 */
@Value
public class CommentCursor {

    int pageIndex;

    public static CommentCursor first() {
        return new CommentCursor(0);
    }

    public CommentCursor next() {
        return new CommentCursor(pageIndex + 1);
    }

    public boolean isFirst() {
        return pageIndex == 0;
    }
}
