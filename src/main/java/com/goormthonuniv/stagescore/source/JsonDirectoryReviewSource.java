package com.goormthonuniv.stagescore.source;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.goormthonuniv.stagescore.dto.RawReview;
import com.goormthonuniv.stagescore.dto.ShowContext;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/** 수집기가 내보낸 &lt;dir&gt;/&lt;showId&gt;.json (RawReview 배열). 파일이 없으면 빈 목록 */
public class JsonDirectoryReviewSource implements ReviewSource {

    private final Path dir;
    private final ObjectMapper objectMapper;

    public JsonDirectoryReviewSource(Path dir, ObjectMapper objectMapper) {
        this.dir = dir;
        this.objectMapper = objectMapper;
    }

    @Override
    public String name() {
        return "json-dir";
    }

    @Override
    public List<RawReview> fetch(ShowContext show) {
        Path file = dir.resolve(show.showId() + ".json").normalize();
        if (!file.startsWith(dir.normalize())) {
            throw new IllegalArgumentException("invalid show id: " + show.showId());
        }
        if (!Files.exists(file)) return List.of();
        try {
            return objectMapper.readValue(file.toFile(), new TypeReference<List<RawReview>>() {});
        } catch (IOException e) {
            throw new UncheckedIOException("cannot read " + file, e);
        }
    }
}
