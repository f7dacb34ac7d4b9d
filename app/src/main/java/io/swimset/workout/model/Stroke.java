package io.swimset.workout.model;

import java.util.List;

/**
 * Swimming strokes recognized on a workout line.
 */
public enum Stroke implements StrokeCategory {
    FREESTYLE("Free", List.of("free", "freestyle", "fr")),
    BACKSTROKE("Back", List.of("back", "backstroke", "bk")),
    BREASTSTROKE("Breast", List.of("breast", "breaststroke", "br")),
    BUTTERFLY("Fly", List.of("fly", "butterfly")),
    IM("IM", List.of("im")),
    CHOICE("Choice", List.of("choice"));

    private final String displayName;
    private final List<String> keywords;

    Stroke(String displayName, List<String> keywords) {
        this.displayName = displayName;
        this.keywords = keywords;
    }

    @Override
    public String displayName() {
        return displayName;
    }

    /**
     * Words that name this stroke in coach notation, in recognition order.
     */
    public List<String> keywords() {
        return keywords;
    }

    public String keyword() {
        return keywords.get(0);
    }
}
