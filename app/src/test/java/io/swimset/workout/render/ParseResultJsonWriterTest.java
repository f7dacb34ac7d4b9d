package io.swimset.workout.render;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.swimset.workout.model.Effort;
import io.swimset.workout.model.ParseResult;
import io.swimset.workout.model.WorkoutLine;
import io.swimset.workout.parse.WorkoutParser;
import org.junit.jupiter.api.Test;

class ParseResultJsonWriterTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final ParseResultJsonWriter writer = new ParseResultJsonWriter(objectMapper);

    @Test
    void writesNestedStructureWithDerivedYardage() throws Exception {
        ParseResult result = new WorkoutParser().parse(String.join("\n",
                "Friday",
                "Main Set",
                "2x thru",
                "  4x100 free @ 1:30 race pace",
                "  100 kick"));

        JsonNode root = objectMapper.readTree(writer.write(result));

        assertThat(root.path("title").asText()).isEqualTo("Friday");
        assertThat(root.path("totalYardage").asInt()).isEqualTo(1000);
        assertThat(root.path("warnings").isArray()).isTrue();
        JsonNode set = root.path("sections").get(0).path("sets").get(0);
        assertThat(set.path("repeatCount").asInt()).isEqualTo(2);
        assertThat(set.path("yardage").asInt()).isEqualTo(1000);

        JsonNode line = set.path("lines").get(0);
        assertThat(line.path("schemaVersion").asInt()).isEqualTo(2);
        assertThat(line.path("stroke").asText()).isEqualTo("freestyle");
        assertThat(line.path("effort").asText()).isEqualTo("racePace");
        assertThat(line.path("intervalSeconds").asInt()).isEqualTo(90);
        assertThat(line.path("intervalKind").asText()).isEqualTo("sendoff");
        assertThat(line.path("yardage").asInt()).isEqualTo(400);
    }

    @Test
    void omitsAbsentOptionalFields() {
        JsonNode node = writer.lineNode(WorkoutLine.textOnly("stretch"));

        assertThat(node.has("reps")).isFalse();
        assertThat(node.has("distance")).isFalse();
        assertThat(node.has("stroke")).isFalse();
        assertThat(node.has("intervalSeconds")).isFalse();
        assertThat(node.path("intervalKind").asText()).isEqualTo("none");
        assertThat(node.path("text").asText()).isEqualTo("stretch");
    }

    @Test
    void omitsTitleWhenAbsent() {
        JsonNode root = writer.toTree(ParseResult.empty());

        assertThat(root.has("title")).isFalse();
        assertThat(root.path("sections").size()).isZero();
        assertThat(root.path("totalYardage").asInt()).isZero();
    }

    @Test
    void writesEffortAsCamelCase() {
        WorkoutLine line = WorkoutLine.builder().reps(1).distance(100).effort(Effort.NEGATIVE_SPLIT).build();

        assertThat(writer.lineNode(line).path("effort").asText()).isEqualTo("negativeSplit");
    }
}
