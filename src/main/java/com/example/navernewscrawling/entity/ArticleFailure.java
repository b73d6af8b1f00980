package com.example.navernewscrawling.entity;

import lombok.Value;

/**
 * 영구 실패한 기사 (재실행 대상)
 */
@Value
public class ArticleFailure {
    String url;
    String reason;
    int attempts;
}
