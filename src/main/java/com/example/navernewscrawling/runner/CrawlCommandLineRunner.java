package com.example.navernewscrawling.runner;

import com.example.navernewscrawling.config.CrawlerProperties;
import com.example.navernewscrawling.service.CrawlRunService;
import com.example.navernewscrawling.service.RunSummary;
import com.example.navernewscrawling.service.UrlListLoader;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;

/**
 * 명령줄 실행
 *
 * 사용 예:
 * java -jar navernewscrawling.jar --urls=urls.txt
 * java -jar navernewscrawling.jar --urls-dir=url_lists --pattern=*.txt --output=result
 * java -jar navernewscrawling.jar --urls=urls.txt --crawler.max-workers=4 --crawler.delay-between-requests=2
 *
 * --urls, --urls-dir가 없으면 아무것도 하지 않고 REST API 서버로 동작합니다.
 * 종료 코드: 0 전체 성공, 1 일부 기사 실패, 2 중단(출력 오류, URL 없음)
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CrawlCommandLineRunner implements ApplicationRunner, ExitCodeGenerator {

    static final String URLS = "urls";
    static final String URLS_DIR = "urls-dir";
    static final String PATTERN = "pattern";
    static final String OUTPUT = "output";

    /** 종료 신호를 받았을 때 진행 중인 기록을 마치기를 기다리는 시간 */
    private static final Duration SHUTDOWN_GRACE = Duration.ofSeconds(30);

    private final CrawlRunService crawlRunService;
    private final CrawlerProperties properties;

    private int exitCode;

    /**
     * 배치 실행 인자가 있는지 확인합니다. (웹 서버 없이 실행할지 결정)
     */
    public static boolean isBatchInvocation(String[] args) {
        return Arrays.stream(args).anyMatch(arg ->
                arg.startsWith("--" + URLS + "=") || arg.startsWith("--" + URLS_DIR + "="));
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!args.containsOption(URLS) && !args.containsOption(URLS_DIR)) {
            return;
        }

        List<String> urls;
        try {
            urls = loadUrls(args);
        } catch (IOException e) {
            log.error("URL 파일을 읽을 수 없습니다: {}", e.getMessage(), e);
            exitCode = 2;
            return;
        }
        if (urls.isEmpty()) {
            log.error("처리할 URL이 없습니다.");
            exitCode = 2;
            return;
        }

        Path outputDir = args.containsOption(OUTPUT)
                ? Path.of(args.getOptionValues(OUTPUT).get(0))
                : properties.getOutput().getDir();

        Thread shutdownHook = new Thread(this::cancelAndWait, "crawl-shutdown");
        Runtime.getRuntime().addShutdownHook(shutdownHook);
        try {
            RunSummary summary = crawlRunService.run(urls, outputDir);
            exitCode = summary.exitCode();
        } finally {
            removeShutdownHook(shutdownHook);
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    private List<String> loadUrls(ApplicationArguments args) throws IOException {
        if (args.containsOption(URLS)) {
            return UrlListLoader.load(Path.of(args.getOptionValues(URLS).get(0)));
        }
        String pattern = args.containsOption(PATTERN)
                ? args.getOptionValues(PATTERN).get(0)
                : UrlListLoader.DEFAULT_PATTERN;
        Path dir = Path.of(args.getOptionValues(URLS_DIR).get(0));
        return UrlListLoader.loadAll(UrlListLoader.findUrlFiles(dir, pattern));
    }

    /**
     * Ctrl+C 등 종료 신호: 새 기사 처리를 멈추고, Writer가 기록 중인 기사를 마칠 때까지 기다립니다.
     */
    private void cancelAndWait() {
        if (!crawlRunService.isRunning()) {
            return;
        }
        log.warn("종료 신호 수신. 크롤링을 취소합니다.");
        crawlRunService.cancel();
        try {
            if (!crawlRunService.awaitIdle(SHUTDOWN_GRACE)) {
                log.warn("{}초 안에 종료되지 않았습니다.", SHUTDOWN_GRACE.toSeconds());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void removeShutdownHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            // JVM 종료가 이미 시작된 경우
            log.debug("종료 훅 제거 생략: {}", e.getMessage());
        }
    }
}
