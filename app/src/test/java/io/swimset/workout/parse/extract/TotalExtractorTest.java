package io.swimset.workout.parse.extract;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class TotalExtractorTest {

    private final TotalExtractor extractor = new TotalExtractor();

    @Test
    void readsLabelledTotals() {
        assertThat(extractor.extract("Total: 600").value()).contains(600);
        assertThat(extractor.extract("warmup: 800 yards").value()).contains(800);
        assertThat(extractor.extract("warmup: 800 yards").remainder()).isEqualTo(" yards");
    }

    @Test
    void readsBareYardageOfThreeOrMoreDigits() {
        assertThat(extractor.extract("2500").value()).contains(2500);
        assertThat(extractor.extract("25").isPresent()).isFalse();
    }
}
