package com.goormthonuniv.stagescore.rating;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class DesignationDetectorTest {

    private final DesignationDetector detector = new DesignationDetector();

    @Test
    void detectsFromExcerpt() {
        assertThat(detector.detect(null, "Critic’s Pick. A joyous revival.")).hasValue(DesignationDetector.CRITICS_PICK);
        assertThat(detector.detect(null, "An absolute must-see.")).hasValue(DesignationDetector.RECOMMENDED);
    }

    @Test
    void explicitDesignationWins() {
        assertThat(detector.detect("Critic's Choice", "Critic's Pick")).hasValue(DesignationDetector.CRITICS_CHOICE);
        assertThat(detector.detect("Best of the Year", null)).hasValue("Best of the Year");
    }

    @Test
    void nothingToDetect() {
        assertThat(detector.detect(null, "A perfectly fine evening.")).isEmpty();
    }
}
