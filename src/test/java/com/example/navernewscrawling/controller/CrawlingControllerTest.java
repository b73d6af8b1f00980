package com.example.navernewscrawling.controller;

import com.example.navernewscrawling.config.CrawlerProperties;
import com.example.navernewscrawling.entity.ArticleFailure;
import com.example.navernewscrawling.service.CrawlRunService;
import com.example.navernewscrawling.service.RunSummary;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Bean;
import org.springframework.test.web.servlet.MockMvc;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(CrawlingController.class)
class CrawlingControllerTest {

    @TestConfiguration
    static class Config {
        @Bean
        CrawlerProperties crawlerProperties() {
            return new CrawlerProperties();
        }
    }

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private CrawlRunService crawlRunService;

    @TempDir
    Path dir;

    @Test
    void crawlRequiresUrlSource() throws Exception {
        mockMvc.perform(post("/crawl"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void crawlStartsRunWithUrlsFromFile() throws Exception {
        Path file = dir.resolve("urls.txt");
        Files.writeString(file, "https://n.news.naver.com/article/001/1\n# skip\n", StandardCharsets.UTF_8);
        when(crawlRunService.startAsync(anyList(), any(Path.class))).thenReturn(true);

        mockMvc.perform(post("/crawl").param("urls", file.toString()).param("output", dir.toString()))
                .andExpect(status().isOk());

        verify(crawlRunService).startAsync(eq(List.of("https://n.news.naver.com/article/001/1")), eq(dir));
    }

    @Test
    void crawlIsRejectedWhileRunning() throws Exception {
        Path file = dir.resolve("urls.txt");
        Files.writeString(file, "https://n.news.naver.com/article/001/1\n", StandardCharsets.UTF_8);
        when(crawlRunService.isRunning()).thenReturn(true);

        mockMvc.perform(post("/crawl").param("urls", file.toString()))
                .andExpect(status().isConflict());

        verify(crawlRunService, never()).startAsync(anyList(), any(Path.class));
    }

    @Test
    void unreadableUrlFileIsBadRequest() throws Exception {
        mockMvc.perform(post("/crawl").param("urls", dir.resolve("missing.txt").toString()))
                .andExpect(status().isBadRequest());
    }

    @Test
    void statusReturnsCountsPerState() throws Exception {
        Map<String, Long> counts = new LinkedHashMap<>();
        counts.put("TOTAL", 3L);
        counts.put("COMPLETED", 2L);
        counts.put("FAILED", 1L);
        when(crawlRunService.getCrawlStatus()).thenReturn(counts);

        mockMvc.perform(get("/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.TOTAL").value(3))
                .andExpect(jsonPath("$.FAILED").value(1));
    }

    @Test
    void summaryIsEmptyBeforeFirstRun() throws Exception {
        when(crawlRunService.getLastSummary()).thenReturn(Optional.empty());

        mockMvc.perform(get("/summary"))
                .andExpect(status().isNoContent());
    }

    @Test
    void summaryReturnsLastRun() throws Exception {
        RunSummary summary = RunSummary.builder()
                .startedAt(LocalDateTime.of(2024, 5, 1, 12, 0))
                .elapsed(Duration.ofSeconds(42))
                .totalUrls(3).succeeded(2).failed(1)
                .failures(List.of(new ArticleFailure("https://b", "timeout", 4)))
                .build();
        when(crawlRunService.getLastSummary()).thenReturn(Optional.of(summary));

        mockMvc.perform(get("/summary"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.succeeded").value(2))
                .andExpect(jsonPath("$.failures[0].url").value("https://b"));
    }

    @Test
    void cancelIsForwardedWhenRunning() throws Exception {
        when(crawlRunService.isRunning()).thenReturn(true);

        mockMvc.perform(post("/crawl/cancel"))
                .andExpect(status().isOk());

        verify(crawlRunService).cancel();
    }
}
