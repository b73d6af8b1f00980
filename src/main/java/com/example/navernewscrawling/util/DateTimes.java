package com.example.navernewscrawling.util;

import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;

/**
 * 날짜/시간 정규화 유틸
 *
 * 출력 파일의 날짜 형식은 yyyy-MM-dd HH:mm:ss 하나로 통일합니다.
 */
public final class DateTimes {

    public static final DateTimeFormatter OUTPUT_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    /** 오프셋이 붙은 형식 (예: 2024-05-01T15:20:11+0900) */
    private static final List<DateTimeFormatter> OFFSET_FORMATS = List.of(
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ssZ"),
            DateTimeFormatter.ISO_OFFSET_DATE_TIME
    );

    private static final List<DateTimeFormatter> LOCAL_FORMATS = List.of(
            OUTPUT_FORMAT,
            DateTimeFormatter.ISO_LOCAL_DATE_TIME,
            DateTimeFormatter.ofPattern("yyyy.MM.dd. a h:mm", Locale.KOREAN),
            DateTimeFormatter.ofPattern("yyyy.MM.dd. a h:mm:ss", Locale.KOREAN),
            DateTimeFormatter.ofPattern("yyyy.MM.dd. HH:mm"),
            DateTimeFormatter.ofPattern("yyyy.MM.dd HH:mm")
    );

    private DateTimes() {
    }

    /**
     * 사이트에서 읽은 날짜 문자열을 출력 형식으로 변환합니다.
     * 오프셋이 있으면 버리고 현지 시각 그대로 사용합니다.
     *
     * @return 변환 결과, 알 수 없는 형식이면 원문(trim), 비어 있으면 null
     */
    public static String normalize(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String text = raw.trim();
        for (DateTimeFormatter f : OFFSET_FORMATS) {
            LocalDateTime parsed = parseOrNull(text, f, true);
            if (parsed != null) {
                return parsed.format(OUTPUT_FORMAT);
            }
        }
        for (DateTimeFormatter f : LOCAL_FORMATS) {
            LocalDateTime parsed = parseOrNull(text, f, false);
            if (parsed != null) {
                return parsed.format(OUTPUT_FORMAT);
            }
        }
        return text;
    }

    private static LocalDateTime parseOrNull(String text, DateTimeFormatter formatter, boolean withOffset) {
        try {
            return withOffset
                    ? OffsetDateTime.parse(text, formatter).toLocalDateTime()
                    : LocalDateTime.parse(text, formatter);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    public static String format(LocalDateTime dateTime) {
        return dateTime == null ? null : dateTime.format(OUTPUT_FORMAT);
    }
}
