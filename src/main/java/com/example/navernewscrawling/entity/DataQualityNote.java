package com.example.navernewscrawling.entity;

import lombok.Value;

/**
 * 치명적이지 않은 데이터 품질 문제 기록
 *
 * 필드 누락, 고아 답글 등은 기사 전체를 실패시키지 않고 이 노트로 남습니다.
 */
@Value
public class DataQualityNote {

    public enum Kind {
        FIELD_MISSING,
        RATIO_OUT_OF_RANGE,
        ORPHAN_REPLY,
        MISSING_SITE_ID,
        PAGINATION_CEILING
    }

    String url;
    Kind kind;
    String detail;

    @Override
    public String toString() {
        return kind + " [" + url + "] " + detail;
    }
}
