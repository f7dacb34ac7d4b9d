package io.swimset.workout.parse;

import static org.assertj.core.api.Assertions.assertThat;

import io.swimset.workout.model.Effort;
import io.swimset.workout.model.IntervalKind;
import io.swimset.workout.model.Stroke;
import io.swimset.workout.model.SwimMode;
import io.swimset.workout.model.WorkoutLine;
import org.junit.jupiter.api.Test;

class LineParserTest {

    private final LineParser parser = new LineParser();

    @Test
    void parsesRepsDistanceStrokeAndSendoff() {
        WorkoutLine line = parser.parseLine("4x100 free @ 1:30").line();

        assertThat(line.reps()).contains(4);
        assertThat(line.distance()).contains(100);
        assertThat(line.stroke()).contains(Stroke.FREESTYLE);
        assertThat(line.mode()).isEmpty();
        assertThat(line.intervalSeconds()).contains(90);
        assertThat(line.intervalKind()).isEqualTo(IntervalKind.SENDOFF);
        assertThat(line.text()).isEmpty();
        assertThat(line.yardage()).isEqualTo(400);
    }

    @Test
    void collapsesNestedRepeatIntoRepCount() {
        WorkoutLine line = parser.parseLine("3x (4x25 kick @ :30)").line();

        assertThat(line.reps()).contains(12);
        assertThat(line.distance()).contains(25);
        assertThat(line.mode()).contains(SwimMode.KICK);
        assertThat(line.intervalSeconds()).contains(30);
        assertThat(line.text()).isEmpty();
    }

    @Test
    void collapsesNestedRepeatWithOnlyAnInterval() {
        WorkoutLine line = parser.parseLine("3x (4x25 @ :25)").line();

        assertThat(line.reps()).contains(12);
        assertThat(line.distance()).contains(25);
        assertThat(line.intervalSeconds()).contains(25);
        assertThat(line.intervalKind()).isEqualTo(IntervalKind.SENDOFF);
    }

    @Test
    void takesFirstEffortAndLeavesTheRestAsText() {
        WorkoutLine line = parser.parseLine("8x50 @ :50 easy/fast by 25").line();

        assertThat(line.reps()).contains(8);
        assertThat(line.distance()).contains(50);
        assertThat(line.intervalSeconds()).contains(50);
        assertThat(line.effort()).contains(Effort.EASY);
        assertThat(line.text()).isEqualTo("/fast by 25");
    }

    @Test
    void treatsLeadingNumberAsSingleDistance() {
        WorkoutLine line = parser.parseLine("200 ez").line();

        assertThat(line.reps()).contains(1);
        assertThat(line.distance()).contains(200);
        assertThat(line.effort()).contains(Effort.EASY);
        assertThat(line.text()).isEmpty();
    }

    @Test
    void keepsStrokeAndModeSeparate() {
        WorkoutLine line = parser.parseLine("6x50 back drill descend").line();

        assertThat(line.stroke()).contains(Stroke.BACKSTROKE);
        assertThat(line.mode()).contains(SwimMode.DRILL);
        assertThat(line.effort()).contains(Effort.DESCEND);
        assertThat(line.text()).isEmpty();
    }

    @Test
    void readsRestIntervals() {
        WorkoutLine after = parser.parseLine("8x50 :15 rest").line();
        WorkoutLine before = parser.parseLine("4x200 pull rest 1:00").line();

        assertThat(after.intervalSeconds()).contains(15);
        assertThat(after.intervalKind()).isEqualTo(IntervalKind.REST);
        assertThat(before.mode()).contains(SwimMode.PULL);
        assertThat(before.intervalSeconds()).contains(60);
        assertThat(before.intervalKind()).isEqualTo(IntervalKind.REST);
    }

    @Test
    void movesParentheticalNotesToTheEndOfTheText() {
        WorkoutLine line = parser.parseLine("4x100 free (breathe every 3) @ 1:40 hold pace").line();

        assertThat(line.stroke()).contains(Stroke.FREESTYLE);
        assertThat(line.intervalSeconds()).contains(100);
        assertThat(line.effort()).contains(Effort.HOLD_PACE);
        assertThat(line.text()).isEqualTo("breathe every 3");
    }

    @Test
    void keepsUnrecognizedWordsAsText() {
        WorkoutLine line = parser.parseLine("10x100 free @ 1:20 with paddles").line();

        assertThat(line.text()).isEqualTo("with paddles");
    }

    @Test
    void stripsListLabels() {
        WorkoutLine lettered = parser.parseLine("A. 4x50 fly").line();
        WorkoutLine ranged = parser.parseLine("1-2: 100 breast").line();

        assertThat(lettered.reps()).contains(4);
        assertThat(lettered.stroke()).contains(Stroke.BUTTERFLY);
        assertThat(ranged.distance()).contains(100);
        assertThat(ranged.stroke()).contains(Stroke.BREASTSTROKE);
    }

    @Test
    void readsTotalOnlyLines() {
        WorkoutLine labelled = parser.parseLine("Total: 600").line();
        WorkoutLine bare = parser.parseLine("1500").line();

        assertThat(labelled.reps()).contains(1);
        assertThat(labelled.distance()).contains(600);
        assertThat(labelled.text()).isEmpty();
        assertThat(bare.distance()).contains(1500);
    }

    @Test
    void fallsBackToTextOnlyLine() {
        ParsedLine parsed = parser.parseLine("Kick on your back with a board");

        assertThat(parsed.hasNumericData()).isFalse();
        assertThat(parsed.line().text()).isEqualTo("Kick on your back with a board");
        assertThat(parsed.line().stroke()).isEmpty();
    }

    @Test
    void flagsDashedTextAsDescriptor() {
        ParsedLine descriptor = parser.parseLine("- focus on long strokes");
        ParsedLine bullet = parser.parseLine("- 4x50 fly");

        assertThat(descriptor.isDescriptor()).isTrue();
        assertThat(descriptor.strippedText()).isEqualTo("focus on long strokes");
        assertThat(bullet.isDescriptor()).isFalse();
        assertThat(bullet.line().reps()).contains(4);
    }

    @Test
    void neverThrowsOnOddInput() {
        assertThat(parser.parseLine("99999999999x100").line().hasNumericData()).isFalse();
        assertThat(parser.parseLine("0x100").line().hasNumericData()).isFalse();
        assertThat(parser.parseLine("").line().text()).isEmpty();
        assertThat(parser.parseLine(null).line().text()).isEmpty();
        assertThat(parser.parseLine("((((").line().text()).isEqualTo("((((");
    }

    @Test
    void keepsUnreadableSendoffAsText() {
        WorkoutLine line = parser.parseLine("5x100 @ 99999999999").line();

        assertThat(line.reps()).contains(5);
        assertThat(line.distance()).contains(100);
        assertThat(line.intervalSeconds()).isEmpty();
        assertThat(line.intervalKind()).isEqualTo(IntervalKind.NONE);
        assertThat(line.text()).isEqualTo("@ 99999999999");
    }

    @Test
    void doesNotMatchKeywordsInsideWords() {
        WorkoutLine line = parser.parseLine("4x50 swimmers choice").line();

        assertThat(line.mode()).isEmpty();
        assertThat(line.stroke()).contains(Stroke.CHOICE);
        assertThat(line.text()).isEqualTo("swimmers");
    }
}
