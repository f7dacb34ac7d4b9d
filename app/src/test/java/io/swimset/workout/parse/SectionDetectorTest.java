package io.swimset.workout.parse;

import static org.assertj.core.api.Assertions.assertThat;

import io.swimset.workout.model.SectionLabel;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

class SectionDetectorTest {

    private final SectionDetector detector = new SectionDetector();

    @ParameterizedTest
    @CsvSource({
            "Warmup, WARMUP",
            "WU, WARMUP",
            "wu, WARMUP",
            "warm up, WARMUP",
            "Warm-Up, WARMUP",
            "warm up - 400 easy, WARMUP",
            "Pre-Set, PRE_SET",
            "Main Set, MAIN_SET",
            "MS:, MAIN_SET",
            "Post Set - Pull, POST_SET",
            "Recovery, POST_SET",
            "Drills, POST_SET",
            "Cool down, COOLDOWN",
            "CD, COOLDOWN",
            "Warm-down, COOLDOWN"
    })
    void recognizesAliases(String line, SectionLabel expected) {
        assertThat(detector.detect(line)).contains(expected);
    }

    @ParameterizedTest
    @ValueSource(strings = {"mslowly", "warmdownstuff", "4x100 free", "Warmups are fun", "", "   "})
    void ignoresNonHeaders(String line) {
        assertThat(detector.detect(line)).isEmpty();
    }

    @Test
    void prefersLongestAlias() {
        assertThat(detector.detect("warm down easy")).contains(SectionLabel.COOLDOWN);
        assertThat(detector.detect("main set: 3 rounds")).contains(SectionLabel.MAIN_SET);
    }

    @Test
    void handlesNull() {
        assertThat(detector.detect(null)).isEmpty();
    }
}
