package io.swimset.workout.model;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.Test;

class YardageTest {

    @Test
    void multipliesDistanceRepsAndRepeatCount() {
        WorkoutLine fly = WorkoutLine.builder().reps(4).distance(50).stroke(Stroke.BUTTERFLY).build();
        WorkoutLine back = WorkoutLine.builder().distance(100).stroke(Stroke.BACKSTROKE).build();
        WorkoutLine note = WorkoutLine.textOnly("stretch");
        Section main = new Section(UUID.randomUUID(), "Main Set",
                List.of(WorkoutSet.repeated(3, List.of(fly, back, note))));

        ParseResult result = new ParseResult(List.of(main), Optional.empty(), List.of());

        assertThat(Yardage.total(result)).isEqualTo(900);
        assertThat(Yardage.setCount(result)).isEqualTo(1);
        assertThat(Yardage.byStroke(result)).containsExactly(
                Map.entry(Stroke.BUTTERFLY, 600),
                Map.entry(Stroke.BACKSTROKE, 300));
    }

    @Test
    void countsModeBeforeStrokeUnlessSwimming() {
        WorkoutLine drill = WorkoutLine.builder().reps(2).distance(50).stroke(Stroke.FREESTYLE).mode(SwimMode.DRILL).build();
        WorkoutLine swim = WorkoutLine.builder().distance(200).stroke(Stroke.FREESTYLE).mode(SwimMode.SWIM).build();
        WorkoutLine kick = WorkoutLine.builder().distance(100).mode(SwimMode.KICK).build();
        Section section = new Section(UUID.randomUUID(), "Warmup",
                List.of(WorkoutSet.single(drill), WorkoutSet.single(swim), WorkoutSet.single(kick)));

        Map<StrokeCategory, Integer> byStroke = Yardage.byStroke(new ParseResult(List.of(section), Optional.empty(), List.of()));

        assertThat(byStroke).containsEntry(SwimMode.DRILL, 100)
                .containsEntry(Stroke.FREESTYLE, 200)
                .containsEntry(SwimMode.KICK, 100)
                .hasSize(3);
    }

    @Test
    void capsYardageInsteadOfWrapping() {
        WorkoutLine huge = WorkoutLine.builder().reps(2).distance(1_500_000_000).stroke(Stroke.FREESTYLE).build();
        WorkoutSet set = WorkoutSet.repeated(3, List.of(huge, huge));
        Section section = new Section(UUID.randomUUID(), "Main Set", List.of(set, set));
        ParseResult result = new ParseResult(List.of(section, section), Optional.empty(), List.of());

        assertThat(huge.yardage()).isEqualTo(Integer.MAX_VALUE);
        assertThat(set.yardage()).isEqualTo(Integer.MAX_VALUE);
        assertThat(section.yardage()).isEqualTo(Integer.MAX_VALUE);
        assertThat(Yardage.total(result)).isEqualTo(Integer.MAX_VALUE);
        assertThat(Yardage.byStroke(result)).containsEntry(Stroke.FREESTYLE, Integer.MAX_VALUE);
    }

    @Test
    void rollsUpYardagePerEffort() {
        WorkoutLine easy = WorkoutLine.builder().distance(200).effort(Effort.EASY).build();
        WorkoutLine fast = WorkoutLine.builder().reps(4).distance(50).effort(Effort.FAST).build();
        WorkoutLine plain = WorkoutLine.builder().distance(300).build();
        Section section = new Section(UUID.randomUUID(), "Main Set",
                List.of(WorkoutSet.single(easy), WorkoutSet.repeated(2, List.of(fast, plain)), WorkoutSet.single(easy)));

        Map<Effort, Integer> byEffort = Yardage.byEffort(new ParseResult(List.of(section), Optional.empty(), List.of()));

        assertThat(byEffort).containsExactly(Map.entry(Effort.EASY, 400), Map.entry(Effort.FAST, 400));
    }

    @Test
    void emptyResultHasNoYardage() {
        assertThat(Yardage.total(ParseResult.empty())).isZero();
        assertThat(Yardage.byStroke(ParseResult.empty())).isEmpty();
    }
}
