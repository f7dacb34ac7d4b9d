package io.swimset.workout.parse;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

class RoundHeaderDetectorTest {

    private final RoundHeaderDetector detector = new RoundHeaderDetector();

    @ParameterizedTest
    @CsvSource({
            "2x thru, 2",
            "3 rounds, 3",
            "1 round, 1",
            "4x:, 4",
            "5 × through, 5",
            "2X ROUNDS, 2"
    })
    void extractsRoundCount(String line, int expected) {
        assertThat(detector.extractRoundCount(line)).hasValue(expected);
    }

    @ParameterizedTest
    @ValueSource(strings = {"4x100 free", "1:00 rest", "200 ez", "0 rounds", "rounds"})
    void rejectsSetLines(String line) {
        assertThat(detector.extractRoundCount(line)).isEmpty();
    }

    @Test
    void handlesNull() {
        assertThat(detector.extractRoundCount(null)).isEmpty();
    }
}
