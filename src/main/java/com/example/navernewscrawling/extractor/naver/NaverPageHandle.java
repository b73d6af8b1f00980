package com.example.navernewscrawling.extractor.naver;

import com.example.navernewscrawling.extractor.PageHandle;
import lombok.extern.slf4j.Slf4j;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebDriverException;

import java.util.HashSet;
import java.util.Set;

/**
 * 기사 한 건 전용 브라우저 세션
 *
 * 한 작업자 스레드에서만 사용하므로 동기화하지 않습니다.
 */
@Slf4j
class NaverPageHandle implements PageHandle {

    private final String url;
    private final WebDriver driver;

    /** 이미 펼친 답글 영역의 소유 댓글 (다시 클릭하면 접힘) */
    private final Set<String> expandedReplyOwners = new HashSet<>();

    private boolean commentViewOpened;

    NaverPageHandle(String url, WebDriver driver) {
        this.url = url;
        this.driver = driver;
    }

    @Override
    public String url() {
        return url;
    }

    WebDriver driver() {
        return driver;
    }

    boolean isCommentViewOpened() {
        return commentViewOpened;
    }

    void markCommentViewOpened() {
        this.commentViewOpened = true;
    }

    /**
     * @return 처음 펼치는 경우 true
     */
    boolean markRepliesExpanded(String owner) {
        return expandedReplyOwners.add(owner);
    }

    @Override
    public void close() {
        try {
            driver.quit();
        } catch (WebDriverException e) {
            log.warn("WebDriver 종료 실패 ({}): {}", url, e.getMessage());
        }
    }
}
