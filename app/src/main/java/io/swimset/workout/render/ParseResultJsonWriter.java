package io.swimset.workout.render;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.swimset.workout.migration.LegacyLineMigrator;
import io.swimset.workout.model.EnumNames;
import io.swimset.workout.model.ParseResult;
import io.swimset.workout.model.Section;
import io.swimset.workout.model.WorkoutLine;
import io.swimset.workout.model.WorkoutSet;
import io.swimset.workout.model.Yardage;
import java.io.UncheckedIOException;
import java.util.Objects;

/**
 * Serializes a parse result to JSON. Absent optional fields are omitted and derived yardage is
 * included at every level for consumers that only read.
 */
public class ParseResultJsonWriter {

    private final ObjectMapper objectMapper;

    public ParseResultJsonWriter() {
        this(new ObjectMapper());
    }

    public ParseResultJsonWriter(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    }

    public String write(ParseResult result) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(toTree(result));
        } catch (JsonProcessingException ex) {
            throw new UncheckedIOException("Failed to serialize parse result", ex);
        }
    }

    public ObjectNode toTree(ParseResult result) {
        ObjectNode root = objectMapper.createObjectNode();
        result.title().ifPresent(title -> root.put("title", title));
        root.put("totalYardage", Yardage.total(result));
        ArrayNode warnings = root.putArray("warnings");
        result.warnings().forEach(warnings::add);
        ArrayNode sections = root.putArray("sections");
        for (Section section : result.sections()) {
            sections.add(sectionNode(section));
        }
        return root;
    }

    private ObjectNode sectionNode(Section section) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("id", section.id().toString());
        node.put("label", section.label());
        node.put("yardage", section.yardage());
        ArrayNode sets = node.putArray("sets");
        for (WorkoutSet set : section.sets()) {
            sets.add(setNode(set));
        }
        return node;
    }

    private ObjectNode setNode(WorkoutSet set) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("id", set.id().toString());
        set.title().ifPresent(title -> node.put("title", title));
        node.put("repeatCount", set.repeatCount());
        node.put("yardage", set.yardage());
        ArrayNode lines = node.putArray("lines");
        for (WorkoutLine line : set.lines()) {
            lines.add(lineNode(line));
        }
        return node;
    }

    /**
     * Stored form of one line at {@link LegacyLineMigrator#CURRENT_SCHEMA_VERSION}; the migrator reads
     * it back unchanged.
     */
    public ObjectNode lineNode(WorkoutLine line) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("schemaVersion", LegacyLineMigrator.CURRENT_SCHEMA_VERSION);
        node.put("id", line.id().toString());
        line.reps().ifPresent(reps -> node.put("reps", reps));
        line.distance().ifPresent(distance -> node.put("distance", distance));
        line.stroke().ifPresent(stroke -> node.put("stroke", EnumNames.toCamel(stroke)));
        line.mode().ifPresent(mode -> node.put("mode", EnumNames.toCamel(mode)));
        line.intervalSeconds().ifPresent(seconds -> node.put("intervalSeconds", seconds));
        node.put("intervalKind", EnumNames.toCamel(line.intervalKind()));
        line.effort().ifPresent(effort -> node.put("effort", EnumNames.toCamel(effort)));
        node.put("text", line.text());
        node.put("yardage", line.yardage());
        return node;
    }
}
