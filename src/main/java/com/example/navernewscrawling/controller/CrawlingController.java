package com.example.navernewscrawling.controller;

import com.example.navernewscrawling.config.CrawlerProperties;
import com.example.navernewscrawling.service.CrawlRunService;
import com.example.navernewscrawling.service.RunSummary;
import com.example.navernewscrawling.service.UrlListLoader;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * 크롤링 제어 REST API 컨트롤러
 *
 * 모든 작업은 비동기로 실행되며, 즉시 응답을 반환합니다.
 * 진행 상황은 /status, 결과는 /summary API로 확인할 수 있습니다.
 */
@Slf4j
@Tag(name = "Crawling Controller", description = "네이버 뉴스 기사/댓글 크롤링 제어 API")
@RestController
@RequiredArgsConstructor
public class CrawlingController {

    private final CrawlRunService crawlRunService;
    private final CrawlerProperties properties;

    /**
     * 크롤링 시작 API
     *
     * URL 파일 하나(urls) 또는 디렉토리(urlsDir + pattern)를 읽어 크롤링을 시작합니다.
     * 실행 중인 작업이 있으면 409를 반환합니다.
     */
    @Operation(summary = "1. 크롤링 시작",
               description = "URL 목록 파일(한 줄에 URL 하나)을 읽어 기사와 댓글을 수집하고 articles.csv / comments.csv에 기록합니다. " +
                       "이어쓰기 모드에서는 이미 기록된 URL을 건너뜁니다.")
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "크롤링이 시작됨"),
        @ApiResponse(responseCode = "400", description = "URL 파일을 읽을 수 없거나 URL이 없음"),
        @ApiResponse(responseCode = "409", description = "이미 크롤링이 실행 중")
    })
    @PostMapping("/crawl")
    public ResponseEntity<String> startCrawl(
        @Parameter(description = "URL 목록 파일 경로", example = "urls.txt")
        @RequestParam(required = false) String urls,
        @Parameter(description = "URL 목록 파일이 있는 디렉토리 (urls가 없을 때 사용)", example = "url_lists")
        @RequestParam(required = false) String urlsDir,
        @Parameter(description = "디렉토리에서 찾을 파일 패턴", example = "*.txt")
        @RequestParam(defaultValue = UrlListLoader.DEFAULT_PATTERN) String pattern,
        @Parameter(description = "출력 디렉토리 (기본값: crawler.output.dir)", example = "output")
        @RequestParam(required = false) String output) {
        if (urls == null && urlsDir == null) {
            return ResponseEntity.badRequest().body("urls 또는 urlsDir 중 하나를 지정해야 합니다.");
        }
        if (crawlRunService.isRunning()) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body("이미 크롤링이 실행 중입니다.");
        }

        List<String> urlList;
        try {
            urlList = urls != null
                    ? UrlListLoader.load(Path.of(urls))
                    : UrlListLoader.loadAll(UrlListLoader.findUrlFiles(Path.of(urlsDir), pattern));
        } catch (IOException e) {
            log.warn("URL 파일 읽기 실패: {}", e.getMessage());
            return ResponseEntity.badRequest().body("URL 파일을 읽을 수 없습니다: " + e.getMessage());
        }
        if (urlList.isEmpty()) {
            return ResponseEntity.badRequest().body("처리할 URL이 없습니다.");
        }

        Path outputDir = output != null ? Path.of(output) : properties.getOutput().getDir();
        if (!crawlRunService.startAsync(urlList, outputDir)) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body("이미 크롤링이 실행 중입니다.");
        }
        return ResponseEntity.ok(urlList.size() + "개 URL의 크롤링을 시작했습니다. (출력: " + outputDir + ")");
    }

    @Operation(summary = "2. 크롤링 취소",
               description = "대기 중인 기사는 처리하지 않고, 처리 중인 기사는 기록하지 않은 채 실패로 남깁니다.")
    @PostMapping("/crawl/cancel")
    public ResponseEntity<String> cancelCrawl() {
        if (!crawlRunService.isRunning()) {
            return ResponseEntity.ok("실행 중인 크롤링이 없습니다.");
        }
        crawlRunService.cancel();
        return ResponseEntity.ok("크롤링 취소를 요청했습니다.");
    }

    /**
     * 작업 현황 조회 API
     *
     * 현재(또는 마지막) 실행의 URL 상태별 개수를 반환합니다.
     */
    @Operation(summary = "3. 작업 현황 조회", description = "상태별(PENDING, IN_PROGRESS, RETRYING, COMPLETED, FAILED, SKIPPED) URL 개수를 조회합니다.")
    @GetMapping("/status")
    public ResponseEntity<Map<String, Long>> getStatus() {
        return ResponseEntity.ok(crawlRunService.getCrawlStatus());
    }

    @Operation(summary = "4. 마지막 실행 요약", description = "마지막으로 끝난 실행의 성공/실패/건너뜀 개수와 실패 URL 목록을 조회합니다.")
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "요약 반환"),
        @ApiResponse(responseCode = "204", description = "아직 끝난 실행이 없음")
    })
    @GetMapping("/summary")
    public ResponseEntity<RunSummary> getSummary() {
        return crawlRunService.getLastSummary()
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.noContent().build());
    }
}
