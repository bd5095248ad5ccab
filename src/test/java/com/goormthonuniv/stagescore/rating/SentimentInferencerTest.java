package com.goormthonuniv.stagescore.rating;

import com.goormthonuniv.stagescore.dto.ReviewFlag;
import com.goormthonuniv.stagescore.dto.ScoreSource;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SentimentInferencerTest {

    private final SentimentInferencer inferencer = new SentimentInferencer();

    @Test
    void strongPraise() {
        assertThat(inferencer.infer("A masterpiece: brilliant and stunning from start to finish."))
                .hasValueSatisfying(r -> {
                    assertThat(r.score()).isEqualTo(88);
                    assertThat(r.source()).isEqualTo(ScoreSource.INFERRED);
                    assertThat(r.flags()).containsExactly(ReviewFlag.INFERRED_SCORE);
                });
    }

    @Test
    void moderatePraise() {
        assertThat(inferencer.infer("A brilliant, stunning and wonderful production."))
                .hasValueSatisfying(r -> assertThat(r.score()).isEqualTo(78));
    }

    @Test
    void harshReview() {
        assertThat(inferencer.infer("Terrible and awful, a boring evening."))
                .hasValueSatisfying(r -> assertThat(r.score()).isEqualTo(35));
        assertThat(inferencer.infer("A tedious, boring and dull evening."))
                .hasValueSatisfying(r -> assertThat(r.score()).isEqualTo(45));
    }

    @Test
    void mixedWordingDominates() {
        assertThat(inferencer.infer("Uneven and inconsistent, with some moments that land."))
                .hasValueSatisfying(r -> assertThat(r.score()).isEqualTo(60));
    }

    @Test
    void keywordsMatchWholeWordsOnly() {
        // "flatter" 은 "flat" 이 아니다
        assertThat(inferencer.signal("The lighting could hardly be flatter or more generic.").negative()).isZero();
    }

    @Test
    void shortOrNeutralTextGivesNothing() {
        assertThat(inferencer.infer("Great.")).isEmpty();
        assertThat(inferencer.infer("The show opened at the Majestic last night.")).isEmpty();
        assertThat(inferencer.infer(null)).isEmpty();
    }
}
