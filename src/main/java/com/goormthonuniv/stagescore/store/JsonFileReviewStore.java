package com.goormthonuniv.stagescore.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.*;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * 공연별 JSON 파일 저장소: &lt;dir&gt;/&lt;showId&gt;.json
 * 임시 파일에 쓴 뒤 원자적 이동으로 교체한다.
 */
@Slf4j
public class JsonFileReviewStore implements ReviewStore {

    private static final Pattern SAFE_ID = Pattern.compile("[A-Za-z0-9._-]+");
    private static final String SUFFIX = ".json";

    private final Path dir;
    private final ObjectMapper objectMapper;

    public JsonFileReviewStore(Path dir, ObjectMapper objectMapper) {
        this.dir = dir;
        this.objectMapper = objectMapper;
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new UncheckedIOException("cannot create store dir " + dir, e);
        }
    }

    @Override
    public Optional<ShowSnapshot> load(String showId) {
        Path file = fileOf(showId);
        if (!Files.exists(file)) return Optional.empty();
        try {
            return Optional.of(objectMapper.readValue(file.toFile(), ShowSnapshot.class));
        } catch (IOException e) {
            throw new UncheckedIOException("cannot read " + file, e);
        }
    }

    @Override
    public void replace(ShowSnapshot snapshot) {
        Path target = fileOf(snapshot.showId());
        Path tmp = null;
        try {
            tmp = Files.createTempFile(dir, snapshot.showId() + ".", ".tmp");
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), snapshot);
            move(tmp, target);
            log.debug("[StageScore] stored show={} reviews={}", snapshot.showId(), snapshot.reviews().size());
        } catch (IOException e) {
            deleteQuietly(tmp);
            throw new UncheckedIOException("cannot write " + target, e);
        }
    }

    @Override
    public Set<String> showIds() {
        Set<String> ids = new TreeSet<>();
        try (Stream<Path> files = Files.list(dir)) {
            files.map(p -> p.getFileName().toString())
                    .filter(n -> n.endsWith(SUFFIX))
                    .forEach(n -> ids.add(n.substring(0, n.length() - SUFFIX.length())));
        } catch (IOException e) {
            throw new UncheckedIOException("cannot list " + dir, e);
        }
        return ids;
    }

    // ------------------------ 내부 유틸 ------------------------

    private Path fileOf(String showId) {
        if (showId == null || !SAFE_ID.matcher(showId).matches()) {
            throw new IllegalArgumentException("invalid show id: " + showId);
        }
        return dir.resolve(showId + SUFFIX);
    }

    private static void move(Path tmp, Path target) throws IOException {
        try {
            Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.warn("[StageScore] atomic move unsupported in {}, falling back to replace", tmp.getParent());
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteQuietly(Path p) {
        if (p == null) return;
        try {
            Files.deleteIfExists(p);
        } catch (IOException e) {
            log.warn("[StageScore] cannot delete temp file {}: {}", p, e.getMessage());
        }
    }
}
