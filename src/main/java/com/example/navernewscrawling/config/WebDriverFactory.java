package com.example.navernewscrawling.config;

import org.openqa.selenium.WebDriver;

/**
 * 기사 한 건마다 독립적인 브라우저 세션을 만드는 팩토리
 *
 * WebDriver는 스레드 안전하지 않으므로 작업자끼리 공유하지 않습니다.
 */
@FunctionalInterface
public interface WebDriverFactory {

    WebDriver create();
}
