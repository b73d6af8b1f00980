package com.example.navernewscrawling.config;

import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.openqa.selenium.Dimension;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.chrome.ChromeDriver;
import org.openqa.selenium.chrome.ChromeOptions;
import org.openqa.selenium.remote.RemoteWebDriver;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.MalformedURLException;
import java.net.URL;
import java.time.Duration;

/**
 * Selenium WebDriver 설정 클래스
 *
 * Chrome 브라우저 자동화를 위한 WebDriver 생성 방식을 정의합니다.
 * - 로컬 환경: ChromeDriver 사용
 * - Docker 환경: RemoteWebDriver 사용 (Selenium Grid)
 *
 * 드라이버는 애플리케이션 시작 시 만들지 않고, 작업자가 기사를 열 때마다 팩토리로 생성합니다.
 */
@Slf4j
@Configuration
public class SeleniumConfig {

    /** Selenium Hub URL (Docker 환경에서 사용, 기본값: http://localhost:4444/wd/hub) */
    @Value("${selenium.hub.url:http://localhost:4444/wd/hub}")
    private String seleniumHubUrl;

    /** Remote WebDriver 사용 여부 (Docker 환경: true, 로컬 환경: false) */
    @Value("${selenium.use.remote:false}")
    private boolean useRemoteDriver;

    /** 헤드리스 모드 여부 */
    @Value("${selenium.headless:true}")
    private boolean headless;

    /** 로컬 chromedriver 경로 (비어 있으면 Selenium Manager가 자동으로 찾음) */
    @Value("${selenium.chrome-driver-path:}")
    private String chromeDriverPath;

    /** 요소 탐색 암묵적 대기 시간 */
    @Value("${selenium.implicit-wait:2s}")
    private Duration implicitWait;

    /**
     * 로컬 환경이고 chromedriver 경로가 지정된 경우 시스템 프로퍼티에 설정합니다.
     */
    @PostConstruct
    void postConstruct() {
        if (!useRemoteDriver && !chromeDriverPath.isBlank()) {
            System.setProperty("webdriver.chrome.driver", chromeDriverPath);
        }
    }

    /**
     * WebDriverFactory Bean 생성
     *
     * @param properties 페이지 로드 타임아웃을 가져올 크롤러 설정
     * @return 호출할 때마다 새 세션을 만드는 팩토리
     */
    @Bean
    public WebDriverFactory webDriverFactory(CrawlerProperties properties) {
        return () -> {
            ChromeOptions options = createChromeOptions();
            WebDriver driver;
            if (useRemoteDriver) {
                try {
                    driver = new RemoteWebDriver(new URL(seleniumHubUrl), options);
                } catch (MalformedURLException e) {
                    throw new IllegalStateException("Selenium Hub URL이 올바르지 않습니다: " + seleniumHubUrl, e);
                }
            } else {
                driver = new ChromeDriver(options);
            }
            postCreateTuning(driver, properties.getTimeout());
            return driver;
        };
    }

    /**
     * Chrome 브라우저 옵션 생성
     *
     * @return 설정된 ChromeOptions
     */
    private ChromeOptions createChromeOptions() {
        ChromeOptions options = new ChromeOptions();
        if (headless || useRemoteDriver) {
            options.addArguments("--headless=new");
        }
        // --- Docker 환경을 위한 안정성 옵션 ---
        options.addArguments("--disable-gpu");
        options.addArguments("--no-sandbox");
        options.addArguments("--disable-dev-shm-usage");
        options.addArguments("--disable-extensions");
        options.addArguments("--lang=ko-KR");
        return options;
    }

    /**
     * WebDriver 생성 후 타임아웃과 창 크기 설정
     *
     * @param driver 설정할 WebDriver 인스턴스
     * @param pageLoadTimeout 요청 타임아웃
     */
    private void postCreateTuning(WebDriver driver, Duration pageLoadTimeout) {
        driver.manage().timeouts().pageLoadTimeout(pageLoadTimeout);
        driver.manage().timeouts().scriptTimeout(pageLoadTimeout);
        driver.manage().timeouts().implicitlyWait(implicitWait);
        driver.manage().window().setSize(new Dimension(1920, 1080));
        log.debug("WebDriver 세션 생성 (remote={}, headless={})", useRemoteDriver, headless);
    }
}
