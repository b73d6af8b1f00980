package com.example.navernewscrawling.entity;

/**
 * 댓글 종류
 *
 * CSV의 comment_type 컬럼에 기록되는 값을 함께 가집니다.
 */
public enum CommentType {
    /** 최상위 댓글 */
    COMMENT("comment"),

    /** 최상위 댓글에 달린 답글 (답글의 답글도 여기로 평탄화) */
    REPLY("reply");

    private final String csvValue;

    CommentType(String csvValue) {
        this.csvValue = csvValue;
    }

    public String csvValue() {
        return csvValue;
    }
}
