package com.example.navernewscrawling;

import com.example.navernewscrawling.runner.CrawlCommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * 네이버 뉴스 크롤링 애플리케이션 메인 클래스
 *
 * --urls / --urls-dir 인자가 있으면 웹 서버 없이 한 번 실행하고 종료 코드와 함께 끝납니다.
 * 인자가 없으면 REST API 서버로 동작합니다. (Swagger UI: /swagger-ui.html)
 */
@SpringBootApplication
public class NavernewscrawlingApplication {

    public static void main(String[] args) {
        SpringApplication application = new SpringApplication(NavernewscrawlingApplication.class);
        if (CrawlCommandLineRunner.isBatchInvocation(args)) {
            application.setWebApplicationType(WebApplicationType.NONE);
            System.exit(SpringApplication.exit(application.run(args)));
        }
        application.run(args);
    }
}
