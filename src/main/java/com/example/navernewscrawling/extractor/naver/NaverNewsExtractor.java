package com.example.navernewscrawling.extractor.naver;

import com.example.navernewscrawling.config.CrawlerProperties;
import com.example.navernewscrawling.config.WebDriverFactory;
import com.example.navernewscrawling.exception.LoadException;
import com.example.navernewscrawling.exception.PaginationException;
import com.example.navernewscrawling.extractor.ArticleExtractor;
import com.example.navernewscrawling.extractor.CommentCursor;
import com.example.navernewscrawling.extractor.CommentPage;
import com.example.navernewscrawling.extractor.PageHandle;
import com.example.navernewscrawling.extractor.RawArticleFields;
import com.example.navernewscrawling.extractor.RawCommentRecord;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.openqa.selenium.By;
import org.openqa.selenium.JavascriptExecutor;
import org.openqa.selenium.TimeoutException;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebDriverException;
import org.openqa.selenium.WebElement;
import org.openqa.selenium.support.ui.ExpectedConditions;
import org.openqa.selenium.support.ui.WebDriverWait;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;

/**
 * 네이버 뉴스 추출기 (Selenium + Jsoup)
 *
 * 기사마다 새 WebDriver 세션을 열고, 렌더링된 페이지 소스를 {@link NaverPageParser}로 파싱합니다.
 * 댓글은 "더보기" 버튼이 누적 로드하는 방식이라, 각 페이지에는 이전 페이지의 댓글이 다시 포함됩니다.
 * 중복 제거는 댓글 트리 빌더가 사이트 댓글 번호로 처리합니다.
 */
@Slf4j
@Component
public class NaverNewsExtractor implements ArticleExtractor {

    private static final String OWNER_INFO_SCRIPT =
            "var li = arguments[0].closest(arguments[1]); return li ? li.getAttribute(arguments[2]) : null;";

    /** 클릭 후 새 댓글이 렌더링되기를 기다리는 최대 시간 */
    private static final Duration RENDER_WAIT = Duration.ofSeconds(3);

    private final WebDriverFactory driverFactory;
    private final NaverSelectors selectors;
    private final NaverPageParser parser;
    private final CleanbotDisabler cleanbot;
    private final boolean disableCleanbot;
    private final Duration timeout;

    public NaverNewsExtractor(WebDriverFactory driverFactory, NaverSelectors selectors, CrawlerProperties properties) {
        this.driverFactory = driverFactory;
        this.selectors = selectors;
        this.parser = new NaverPageParser(selectors);
        this.cleanbot = new CleanbotDisabler(selectors, RENDER_WAIT);
        this.disableCleanbot = properties.isDisableCleanbot();
        this.timeout = properties.getTimeout();
    }

    @Override
    public PageHandle load(String url) {
        WebDriver driver;
        try {
            driver = driverFactory.create();
        } catch (WebDriverException e) {
            throw new LoadException("WebDriver 세션 생성 실패: " + e.getMessage(), e);
        }

        NaverPageHandle page = new NaverPageHandle(url, driver);
        try {
            driver.get(url);
            new WebDriverWait(driver, timeout)
                    .until(ExpectedConditions.presenceOfElementLocated(By.tagName("body")));
            return page;
        } catch (TimeoutException e) {
            page.close();
            throw new LoadException("페이지 로드 타임아웃: " + url, e);
        } catch (WebDriverException e) {
            page.close();
            throw new LoadException("페이지 로드 실패: " + url + " (" + e.getMessage() + ")", e);
        }
    }

    @Override
    public RawArticleFields extractMetadata(PageHandle page) {
        NaverPageHandle handle = (NaverPageHandle) page;
        try {
            return parser.parseArticle(snapshot(handle));
        } catch (WebDriverException e) {
            throw new LoadException("페이지 소스 조회 실패: " + page.url(), e);
        }
    }

    @Override
    public boolean hasComments(PageHandle page) {
        NaverPageHandle handle = (NaverPageHandle) page;
        try {
            return !handle.driver().findElements(By.cssSelector(selectors.getCommentButton())).isEmpty()
                    || !handle.driver().findElements(By.cssSelector(selectors.getCommentItem())).isEmpty();
        } catch (WebDriverException e) {
            throw new LoadException("댓글 영역 확인 실패: " + page.url(), e);
        }
    }

    @Override
    public CommentPage fetchCommentPage(PageHandle page, CommentCursor cursor) {
        NaverPageHandle handle = (NaverPageHandle) page;
        try {
            if (cursor.isFirst()) {
                openCommentView(handle);
            } else {
                loadMore(handle);
            }
            expandReplies(handle);

            List<RawCommentRecord> records = parser.parseComments(snapshot(handle));
            boolean hasMore = isMoreButtonVisible(handle.driver());
            log.debug("댓글 페이지 {} 로드: {}건 (더보기 {})", cursor.getPageIndex(), records.size(), hasMore);
            return hasMore ? CommentPage.of(records, cursor.next()) : CommentPage.last(records);
        } catch (WebDriverException e) {
            throw new PaginationException("댓글 페이지 " + cursor.getPageIndex() + " 로드 실패: " + e.getMessage(), e);
        }
    }

    /**
     * 댓글 보기 버튼을 눌러 댓글 목록으로 이동합니다. 이미 목록이 열려 있으면 그대로 사용합니다.
     * 첫 댓글 페이지를 읽기 전에 클린봇을 해제합니다.
     */
    private void openCommentView(NaverPageHandle page) {
        if (page.isCommentViewOpened()) {
            return;
        }
        WebDriver driver = page.driver();
        List<WebElement> buttons = driver.findElements(By.cssSelector(selectors.getCommentButton()));
        if (!buttons.isEmpty()) {
            click(driver, buttons.get(0));
            waitForCommentList(page);
        }
        // 해제하면 목록이 다시 그려짐
        if (disableCleanbot && cleanbot.disable(driver, page.url()) == CleanbotDisabler.Result.DISABLED) {
            waitForCommentList(page);
        }
        page.markCommentViewOpened();
    }

    private void waitForCommentList(NaverPageHandle page) {
        try {
            new WebDriverWait(page.driver(), timeout)
                    .until(ExpectedConditions.presenceOfElementLocated(By.cssSelector(selectors.getCommentItem())));
        } catch (TimeoutException e) {
            log.debug("댓글 목록 요소가 나타나지 않음 (댓글 없음으로 처리): {}", page.url());
        }
    }

    private void loadMore(NaverPageHandle page) {
        WebDriver driver = page.driver();
        List<WebElement> more = driver.findElements(By.cssSelector(selectors.getMoreButton()));
        if (more.isEmpty() || !more.get(0).isDisplayed()) {
            throw new PaginationException("더보기 버튼이 사라짐: " + page.url());
        }
        int before = countComments(driver);
        click(driver, more.get(0));
        waitForMoreComments(driver, before);
    }

    /**
     * 답글이 있는 댓글의 답글 영역을 펼칩니다. 한 번 펼친 영역은 다시 누르지 않습니다.
     */
    private void expandReplies(NaverPageHandle page) {
        WebDriver driver = page.driver();
        JavascriptExecutor js = (JavascriptExecutor) driver;
        for (WebElement button : driver.findElements(By.cssSelector(selectors.getReplyButton()))) {
            Long replies = NaverPageParser.firstNumber(button.getText());
            if (replies == null || replies == 0) {
                continue;
            }
            Object owner = js.executeScript(OWNER_INFO_SCRIPT, button,
                    selectors.getCommentItem(), selectors.getCommentInfoAttribute());
            if (owner == null || !page.markRepliesExpanded(owner.toString())) {
                continue;
            }
            int before = countComments(driver);
            click(driver, button);
            waitForMoreComments(driver, before);
        }
    }

    private void waitForMoreComments(WebDriver driver, int before) {
        try {
            new WebDriverWait(driver, RENDER_WAIT).until(d -> countComments(d) > before);
        } catch (TimeoutException e) {
            // 새 요소가 없으면 트리 빌더가 "새 레코드 0건"으로 페이지네이션을 끝냄
            log.debug("{}초 내 새 댓글 없음 (현재 {}건)", RENDER_WAIT.toSeconds(), before);
        }
    }

    private boolean isMoreButtonVisible(WebDriver driver) {
        List<WebElement> more = driver.findElements(By.cssSelector(selectors.getMoreButton()));
        return !more.isEmpty() && more.get(0).isDisplayed();
    }

    private int countComments(WebDriver driver) {
        return driver.findElements(By.cssSelector(selectors.getCommentItem())).size();
    }

    private void click(WebDriver driver, WebElement element) {
        ((JavascriptExecutor) driver).executeScript("arguments[0].click();", element);
    }

    private Document snapshot(NaverPageHandle page) {
        return Jsoup.parse(page.driver().getPageSource(), page.url());
    }
}
