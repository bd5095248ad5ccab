package com.goormthonuniv.stagescore.source;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.goormthonuniv.stagescore.dto.RawReview;
import com.goormthonuniv.stagescore.dto.ShowContext;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsonDirectoryReviewSourceTest {

    @TempDir
    Path dir;

    @Test
    void readsExportedReviewsForShow() throws Exception {
        Files.writeString(dir.resolve("hamlet-2026.json"), """
                [
                  {"source": "dtli", "outletName": "NY Times", "url": "https://nytimes.com/r/1",
                   "criticName": "Jesse Green", "publishDate": "2026-03-12", "originalRating": "Rave"},
                  {"source": "bww", "outletName": "Variety", "excerpt": "A dazzling, soaring revival."}
                ]
                """);
        JsonDirectoryReviewSource source = new JsonDirectoryReviewSource(dir, new ObjectMapper());

        List<RawReview> reviews = source.fetch(ShowContext.of("hamlet-2026"));

        assertThat(source.name()).isEqualTo("json-dir");
        assertThat(reviews).extracting(RawReview::outletName).containsExactly("NY Times", "Variety");
        assertThat(reviews.get(0).hasRating()).isTrue();
        assertThat(reviews.get(1).hasExcerpt()).isTrue();
    }

    @Test
    void missingFileMeansNoReviews() {
        assertThat(new JsonDirectoryReviewSource(dir, new ObjectMapper()).fetch(ShowContext.of("unknown"))).isEmpty();
    }

    @Test
    void showIdCannotEscapeDirectory() {
        JsonDirectoryReviewSource source = new JsonDirectoryReviewSource(dir, new ObjectMapper());
        assertThatThrownBy(() -> source.fetch(ShowContext.of("../secrets")))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
