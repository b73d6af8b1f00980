package com.example.navernewscrawling.service;

import com.example.navernewscrawling.entity.CrawlStatus;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 크롤링 진행 상황을 실시간으로 추적하는 싱글톤 컴포넌트.
 * 작업자, Writer, 컨트롤러 스레드에서 동시에 접근할 수 있습니다.
 */
@Component
public class CrawlProgressTracker {

    private final Map<String, CrawlStatus> statuses = new ConcurrentHashMap<>();

    /**
     * URL의 상태를 변경합니다. 최종 상태(COMPLETED, FAILED, SKIPPED)는 다시 바뀌지 않습니다.
     */
    public void update(String url, CrawlStatus status) {
        statuses.compute(url, (key, current) -> (current != null && current.isTerminal()) ? current : status);
    }

    public CrawlStatus statusOf(String url) {
        return statuses.get(url);
    }

    /**
     * 상태별 URL 개수 (TOTAL 포함)
     */
    public Map<String, Long> counts() {
        Map<CrawlStatus, Long> byStatus = new EnumMap<>(CrawlStatus.class);
        for (CrawlStatus status : CrawlStatus.values()) {
            byStatus.put(status, 0L);
        }
        statuses.values().forEach(status -> byStatus.merge(status, 1L, Long::sum));

        Map<String, Long> result = new LinkedHashMap<>();
        result.put("TOTAL", (long) statuses.size());
        byStatus.forEach((status, count) -> result.put(status.name(), count));
        return result;
    }

    /**
     * 모든 상태를 지웁니다. (새로운 실행 시작 시 호출)
     */
    public void reset() {
        statuses.clear();
    }
}
