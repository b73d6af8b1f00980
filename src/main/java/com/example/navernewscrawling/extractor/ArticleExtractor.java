package com.example.navernewscrawling.extractor;

import com.example.navernewscrawling.exception.LoadException;
import com.example.navernewscrawling.exception.PaginationException;

/**
 * 기사 페이지 추출 포트
 *
 * 크롤링 핵심 로직(작업자, 댓글 트리 빌더, 스케줄러)은 이 인터페이스에만 의존하며
 * CSS 선택자나 브라우저 드라이버를 직접 다루지 않습니다.
 * 사이트/버전마다 구현체를 하나씩 둡니다.
 *
 * 구현체는 여러 작업자 스레드에서 동시에 호출되므로, 세션 상태는 {@link PageHandle}에 두어야 합니다.
 */
public interface ArticleExtractor {

    /**
     * 기사 페이지를 엽니다.
     *
     * @param url 기사 URL
     * @return 열린 페이지 (호출자가 close 책임)
     * @throws LoadException 이동/로드 타임아웃 등 일시적 실패
     */
    PageHandle load(String url);

    /**
     * 기사 메타데이터를 추출합니다. 찾지 못한 필드는 null로 채웁니다.
     */
    RawArticleFields extractMetadata(PageHandle page);

    /**
     * @return 댓글 진입점이 있으면 true
     */
    boolean hasComments(PageHandle page);

    /**
     * 커서 위치의 댓글 페이지를 가져옵니다.
     *
     * @param cursor 첫 호출은 {@link CommentCursor#first()}
     * @return 원시 댓글 목록과 다음 커서 (없으면 마지막 페이지)
     * @throws PaginationException 댓글 페이지 로드 실패
     */
    CommentPage fetchCommentPage(PageHandle page, CommentCursor cursor);
}
