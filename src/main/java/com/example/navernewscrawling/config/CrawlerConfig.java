package com.example.navernewscrawling.config;

import com.example.navernewscrawling.extractor.naver.NaverSelectors;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * 크롤러 공통 Bean 설정
 */
@Configuration
@EnableConfigurationProperties({CrawlerProperties.class, NaverSelectors.class})
public class CrawlerConfig {

    /** scraped_at 등 시각 기록용 (테스트에서 고정 시계로 교체) */
    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
