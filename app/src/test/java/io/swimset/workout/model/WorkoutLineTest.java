package io.swimset.workout.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class WorkoutLineTest {

    @Test
    void yardageDefaultsRepsToOne() {
        assertThat(WorkoutLine.builder().distance(200).build().yardage()).isEqualTo(200);
        assertThat(WorkoutLine.builder().reps(3).distance(100).build().yardage()).isEqualTo(300);
        assertThat(WorkoutLine.textOnly("easy choice").yardage()).isZero();
    }

    @Test
    void appendsTextWithSingleSpace() {
        WorkoutLine line = WorkoutLine.textOnly("");

        assertThat(line.appendText("long").appendText("strong").text()).isEqualTo("long strong");
        assertThat(line.appendText("  ")).isSameAs(line);
    }

    @Test
    void rejectsInvalidNumbers() {
        assertThatThrownBy(() -> WorkoutLine.builder().reps(0).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> WorkoutLine.builder().distance(-25).build())
                .isInstanceOf(IllegalArgumentException.class);
    }
}
