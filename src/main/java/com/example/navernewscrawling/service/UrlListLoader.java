package com.example.navernewscrawling.service;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FileUtils;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * URL 목록 파일 로더
 *
 * 파일 형식: UTF-8, 한 줄에 URL 하나.
 * - 빈 줄과 #으로 시작하는 줄은 무시
 * - http로 시작하지 않는 줄은 경고 후 무시
 * - 중복 URL은 처음 나온 것만 사용
 */
@Slf4j
public final class UrlListLoader {

    public static final String DEFAULT_PATTERN = "*.txt";

    private UrlListLoader() {
    }

    public static List<String> load(Path file) throws IOException {
        return loadAll(List.of(file));
    }

    /**
     * 여러 파일을 순서대로 읽어 하나의 목록으로 합칩니다.
     */
    public static List<String> loadAll(List<Path> files) throws IOException {
        Set<String> urls = new LinkedHashSet<>();
        int duplicates = 0;
        for (Path file : files) {
            List<String> lines = FileUtils.readLines(file.toFile(), StandardCharsets.UTF_8);
            int lineNo = 0;
            for (String raw : lines) {
                lineNo++;
                String line = raw.strip();
                if (line.isEmpty() || line.startsWith("#")) {
                    continue;
                }
                if (!line.startsWith("http")) {
                    log.warn("잘못된 URL 형식 무시 ({}:{}): {}", file.getFileName(), lineNo, line);
                    continue;
                }
                if (!urls.add(line)) {
                    duplicates++;
                }
            }
            log.info("URL 파일 로드: {}", file);
        }
        if (duplicates > 0) {
            log.info("중복 URL {}개 제거", duplicates);
        }
        log.info("총 {}개의 URL을 로드했습니다.", urls.size());
        return new ArrayList<>(urls);
    }

    /**
     * 디렉토리에서 패턴에 맞는 URL 파일을 이름순으로 찾습니다.
     *
     * @param pattern glob 패턴 (예: *.txt)
     */
    public static List<Path> findUrlFiles(Path dir, String pattern) throws IOException {
        if (!Files.isDirectory(dir)) {
            throw new IOException("디렉토리를 찾을 수 없습니다: " + dir);
        }
        List<Path> files = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir, pattern)) {
            for (Path path : stream) {
                if (Files.isRegularFile(path)) {
                    files.add(path);
                }
            }
        }
        files.sort(null);
        log.info("{}에서 URL 파일 {}개 발견 (패턴: {})", dir, files.size(), pattern);
        return files;
    }
}
