package com.example.navernewscrawling.extractor.naver;

import lombok.extern.slf4j.Slf4j;
import org.openqa.selenium.By;
import org.openqa.selenium.JavascriptExecutor;
import org.openqa.selenium.SearchContext;
import org.openqa.selenium.TimeoutException;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebDriverException;
import org.openqa.selenium.WebElement;
import org.openqa.selenium.support.ui.WebDriverWait;

import java.time.Duration;
import java.util.List;

/**
 * 댓글 클린봇 해제
 *
 * 클린봇이 켜져 있으면 일부 댓글이 목록에서 숨겨집니다.
 * 설정 모달을 열어 체크박스를 끄고 저장합니다. 실패해도 예외를 던지지 않고
 * 경고만 남긴 뒤 클린봇이 켜진 상태로 수집을 계속합니다.
 */
@Slf4j
class CleanbotDisabler {

    enum Result {
        /** 클린봇 영역 없음 */
        NOT_PRESENT,
        ALREADY_OFF,
        DISABLED,
        FAILED
    }

    private final NaverSelectors selectors;
    private final Duration wait;

    CleanbotDisabler(NaverSelectors selectors, Duration wait) {
        this.selectors = selectors;
        this.wait = wait;
    }

    Result disable(WebDriver driver, String url) {
        try {
            WebElement container = first(driver, selectors.getCleanbotContainer());
            if (container == null) {
                log.debug("클린봇 영역 없음: {}", url);
                return Result.NOT_PRESENT;
            }
            WebElement message = first(container, selectors.getCleanbotMessage());
            if (message != null && message.getText().contains(selectors.getCleanbotOffLabel())) {
                log.info("  ├─ 클린봇 해제 확인");
                return Result.ALREADY_OFF;
            }

            WebElement settingButton = first(container, selectors.getCleanbotSettingButton());
            if (settingButton == null || !settingButton.isDisplayed()) {
                log.warn("클린봇 설정 버튼이 보이지 않음: {}", url);
                return Result.FAILED;
            }
            click(driver, settingButton);

            WebElement modal = new WebDriverWait(driver, wait).until(d -> visible(d, selectors.getCleanbotModal()));
            WebElement checkbox = first(modal, selectors.getCleanbotCheckbox());
            if (checkbox == null) {
                log.warn("클린봇 체크박스를 찾을 수 없음: {}", url);
                closeModal(driver);
                return Result.FAILED;
            }

            boolean wasOn = isChecked(checkbox);
            if (wasOn) {
                click(driver, checkbox);
                if (!waitUntilOff(driver, checkbox)) {
                    log.warn("클린봇 비활성화에 실패함: {}", url);
                    closeModal(driver);
                    return Result.FAILED;
                }
            }

            WebElement confirm = first(modal, selectors.getCleanbotConfirmButton());
            if (confirm == null) {
                log.warn("클린봇 확인 버튼을 찾을 수 없음: {}", url);
                closeModal(driver);
                return wasOn ? Result.FAILED : Result.ALREADY_OFF;
            }
            click(driver, confirm);

            if (wasOn) {
                log.info("  ├─ 클린봇 비활성화 완료");
                return Result.DISABLED;
            }
            log.debug("클린봇이 이미 비활성화되어 있음: {}", url);
            return Result.ALREADY_OFF;
        } catch (TimeoutException e) {
            log.warn("클린봇 설정 모달 대기 시간 초과: {}", url);
            closeModal(driver);
            return Result.FAILED;
        } catch (WebDriverException e) {
            log.warn("클린봇 비활성화 실패 ({}): {}", url, e.getMessage());
            closeModal(driver);
            return Result.FAILED;
        }
    }

    private boolean waitUntilOff(WebDriver driver, WebElement checkbox) {
        try {
            new WebDriverWait(driver, wait).until(d -> !isChecked(checkbox));
            return true;
        } catch (TimeoutException e) {
            return false;
        }
    }

    private void closeModal(WebDriver driver) {
        try {
            WebElement close = first(driver, selectors.getCleanbotCloseButton());
            if (close != null && close.isDisplayed()) {
                click(driver, close);
                log.warn("클린봇 설정 모달 강제 닫기");
            }
        } catch (WebDriverException e) {
            log.debug("클린봇 모달 닫기 실패: {}", e.getMessage());
        }
    }

    private boolean isChecked(WebElement checkbox) {
        String classes = checkbox.getAttribute("class");
        return classes != null && classes.contains(selectors.getCleanbotCheckedClass());
    }

    private static WebElement visible(SearchContext context, String css) {
        for (WebElement element : context.findElements(By.cssSelector(css))) {
            if (element.isDisplayed()) {
                return element;
            }
        }
        return null;
    }

    private static WebElement first(SearchContext context, String css) {
        List<WebElement> found = context.findElements(By.cssSelector(css));
        return found.isEmpty() ? null : found.get(0);
    }

    private static void click(WebDriver driver, WebElement element) {
        ((JavascriptExecutor) driver).executeScript("arguments[0].click();", element);
    }
}
